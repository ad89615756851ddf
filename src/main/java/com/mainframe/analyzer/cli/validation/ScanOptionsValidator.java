package com.mainframe.analyzer.cli.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mainframe.analyzer.cli.exception.OptionsValidationException;
import com.mainframe.analyzer.cli.model.ScanOptions;
import com.mainframe.analyzer.cli.model.ValidatedScanOptions;
import com.mainframe.analyzer.config.ScannerConfig;
import com.mainframe.analyzer.docs.SummarizerConfig;
import com.mainframe.analyzer.docs.SummarizerKind;
import com.mainframe.analyzer.util.CobolNamingUtil;

public class ScanOptionsValidator {

	public ValidatedScanOptions validate(ScanOptions o) {
		List<String> errors = new ArrayList<>();

		Path sourcePath = null;
		if (o.getSource() == null) {
			errors.add("Source file is required (--source / -s).");
		} else {
			sourcePath = o.getSource().toAbsolutePath().normalize();
			if (!Files.isRegularFile(sourcePath)) {
				errors.add("Source file does not exist or is not a regular file: " + o.getSource());
			} else if (!Files.isReadable(sourcePath)) {
				errors.add("Source file is not readable: " + o.getSource());
			}
		}

		Charset charset = parseCharset(o.getCharset(), errors);

		Path outputPath = resolveOutput(o, sourcePath);
		if (outputPath != null) {
			if (outputPath.equals(sourcePath)) {
				errors.add("Output file must differ from the source file: " + outputPath);
			} else if (Files.isDirectory(outputPath)) {
				errors.add("Output path is a directory: " + outputPath);
			} else if (Files.exists(outputPath) && !o.isForce()) {
				errors.add("Output file already exists: " + outputPath + ". Use --force to overwrite.");
			}
		}

		Path docsDir = null;
		if (o.getDocsDir() != null) {
			docsDir = o.getDocsDir().toAbsolutePath().normalize();
			if (Files.exists(docsDir) && !Files.isDirectory(docsDir)) {
				errors.add("Documentation directory is not a directory: " + o.getDocsDir());
			}
		}

		SummarizerConfig summarizerConfig = null;
		if (docsDir != null && o.getSummarizer() == SummarizerKind.AZURE_OPENAI) {
			summarizerConfig = validateAzure(o, errors);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ScannerConfig scannerConfig = ScannerConfig.builder()
				.duplicateNamePolicy(o.getDuplicateNamePolicy())
				.edgeOrdering(o.getEdgeOrdering())
				.reportDuplicates(o.isReportDuplicates())
				.build();

		return new ValidatedScanOptions(sourcePath, charset, outputPath, scannerConfig, docsDir, summarizerConfig);
	}

	private static Path resolveOutput(ScanOptions o, Path sourcePath) {
		if (o.getOutput() != null) {
			return o.getOutput().toAbsolutePath().normalize();
		}
		if (sourcePath == null) {
			return null;
		}
		String stem = CobolNamingUtil.stripExtension(sourcePath.getFileName().toString());
		return sourcePath.resolveSibling(stem + ".json");
	}

	private static Charset parseCharset(String name, List<String> errors) {
		if (isBlank(name)) {
			errors.add("Charset must not be blank (--charset).");
			return null;
		}
		try {
			return Charset.forName(name.trim());
		} catch (IllegalArgumentException e) {
			// IllegalCharsetNameException and UnsupportedCharsetException
			errors.add("Unsupported charset: " + name);
			return null;
		}
	}

	private static SummarizerConfig validateAzure(ScanOptions o, List<String> errors) {
		int before = errors.size();

		if (isBlank(o.getAzureEndpoint())) {
			errors.add("Azure OpenAI endpoint is required for --summarizer AZURE_OPENAI (--azure-endpoint).");
		} else if (!isHttpUri(o.getAzureEndpoint())) {
			errors.add("Azure OpenAI endpoint must be an http(s) URL. Got: " + o.getAzureEndpoint());
		}
		if (isBlank(o.getAzureDeployment())) {
			errors.add("Azure OpenAI deployment is required for --summarizer AZURE_OPENAI (--azure-deployment).");
		}
		if (isBlank(o.getAzureApiKey())) {
			errors.add("Azure OpenAI API key is required: pass --azure-api-key or set AZURE_OPENAI_API_KEY.");
		}
		if (isBlank(o.getAzureApiVersion())) {
			errors.add("Azure OpenAI API version must not be blank (--azure-api-version).");
		}

		if (errors.size() > before) {
			return null;
		}

		return SummarizerConfig.builder()
				.endpoint(o.getAzureEndpoint().trim())
				.deployment(o.getAzureDeployment().trim())
				.apiKey(o.getAzureApiKey().trim())
				.apiVersion(o.getAzureApiVersion().trim())
				.build();
	}

	private static boolean isHttpUri(String raw) {
		try {
			URI uri = new URI(raw.trim());
			String scheme = uri.getScheme();
			return uri.getHost() != null && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
		} catch (URISyntaxException e) {
			return false;
		}
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
