package com.mainframe.analyzer.cli.model;

import java.nio.file.Path;

import com.mainframe.analyzer.config.DuplicateNamePolicy;
import com.mainframe.analyzer.config.EdgeOrdering;
import com.mainframe.analyzer.docs.SummarizerKind;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "scan" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ScanOptions {

	@Option(names = { "--source", "-s" }, required = true, description = "COBOL source file to scan")
	private Path source;

	@Option(names = { "--output",
			"-o" }, description = "JSON file receiving the program structure (defaults to <source-name>.json next to the source)")
	private Path output;

	@Option(names = { "--charset" }, defaultValue = "UTF-8", description = "Character set of the source file (default: UTF-8)")
	private String charset;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	// Scanner behaviour
	@Option(names = {
			"--duplicates" }, defaultValue = "LAST_WINS", description = "Repeated division/paragraph names: LAST_WINS or COLLECT_ALL")
	private DuplicateNamePolicy duplicateNamePolicy;

	@Option(names = {
			"--edge-order" }, defaultValue = "PATTERN_CLASS", description = "PERFORM/CALL edge order: PATTERN_CLASS or DOCUMENT_ORDER")
	private EdgeOrdering edgeOrdering;

	@Option(names = { "--report-duplicates" }, description = "Log a warning for every repeated division/paragraph name")
	private boolean reportDuplicates;

	// Documentation
	@Option(names = { "--docs-dir", "-d" }, description = "Write one Markdown page per paragraph into this directory")
	private Path docsDir;

	@Option(names = {
			"--summarizer" }, defaultValue = "STRUCTURAL", description = "Paragraph summarizer: STRUCTURAL or AZURE_OPENAI")
	private SummarizerKind summarizer;

	@Option(names = { "--azure-endpoint" }, description = "Azure OpenAI resource endpoint")
	private String azureEndpoint;

	@Option(names = { "--azure-deployment" }, description = "Azure OpenAI deployment name, e.g. gpt-4o")
	private String azureDeployment;

	@Option(names = {
			"--azure-api-key" }, defaultValue = "${env:AZURE_OPENAI_API_KEY}", description = "Azure OpenAI API key (default: $AZURE_OPENAI_API_KEY)")
	private String azureApiKey;

	@Option(names = { "--azure-api-version" }, defaultValue = "2024-02-01", description = "Azure OpenAI API version")
	private String azureApiVersion;
}
