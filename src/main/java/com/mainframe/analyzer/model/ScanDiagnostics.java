package com.mainframe.analyzer.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Warnings and informational notes accumulated during a scan.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ScanDiagnostics {
  private final List<String> warnings = new ArrayList<>();
  private final List<String> infos = new ArrayList<>();

  public boolean hasWarnings() {
	  return !this.warnings.isEmpty();
  }

}
