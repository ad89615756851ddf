package com.mainframe.analyzer.docs;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders prompts and Markdown pages from the FreeMarker templates under
 * {@code /templates} on the class path.
 */
public class DocumentationRenderer {

    static final String PROMPT_TEMPLATE = "paragraph-prompt.ftl";
    static final String PARAGRAPH_TEMPLATE = "paragraph-doc.ftl";
    static final String INDEX_TEMPLATE = "index.ftl";

    private final Configuration freemarkerConfig;

    public DocumentationRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * User prompt asking for a paragraph's purpose, inputs, outputs and side effects.
     */
    public String renderPrompt(String name, String code) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("name", name);
        model.put("code", code);
        return render(PROMPT_TEMPLATE, model);
    }

    public String renderParagraph(ParagraphDocument document) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("doc", document);
        return render(PARAGRAPH_TEMPLATE, model);
    }

    public String renderIndex(String title, List<ParagraphDocument> documents, List<String> copybooks) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("title", title);
        model.put("docs", documents);
        model.put("copybooks", copybooks);
        return render(INDEX_TEMPLATE, model);
    }

    private String render(String templateName, Map<String, Object> model) throws IOException {
        Template template = freemarkerConfig.getTemplate(templateName);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render template " + templateName + ": " + e.getMessage(), e);
        }
        return out.toString();
    }
}
