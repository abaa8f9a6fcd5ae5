package com.github.salilvnair.convflow.engine.expression.template;

import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders scenario text with Thymeleaf in TEXT mode.
 * <p>
 * Besides native {@code [[${slots.city}]]} inlining, {@code {{ slots.city }}} is accepted as a shorthand.
 */
public class ScenarioTemplateRenderer {

    private static final Pattern SHORTHAND_VAR_PATTERN = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");

    private final SpringTemplateEngine templateEngine;

    public ScenarioTemplateRenderer() {
        StringTemplateResolver resolver = new StringTemplateResolver();
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCacheable(true);

        SpringTemplateEngine engine = new SpringTemplateEngine();
        engine.setTemplateResolver(resolver);
        engine.setEnableSpringELCompiler(true);
        this.templateEngine = engine;
    }

    public String render(String template, Map<String, Object> variables) {
        String raw = template == null ? "" : template;
        if (!isTemplate(raw)) {
            return raw;
        }
        Context context = new Context();
        context.setVariables(variables);
        try {
            String rendered = templateEngine.process(normalizeTemplate(raw), context);
            return rendered == null ? "" : rendered;
        } catch (TemplateEngineException e) {
            throw new DialogFlowException(
                    DialogFlowErrorCode.SCENARIO_EVALUATION_FAILED,
                    "Failed to render '" + raw + "': " + e.getMessage(),
                    e
            ).withMetaData(Map.of("template", raw));
        }
    }

    /**
     * Whether the text carries any inlined expression or text-mode element.
     */
    public static boolean isTemplate(String text) {
        return text != null
                && (text.contains("[[") || text.contains("[(") || text.contains("[#") || text.contains("{{"));
    }

    private String normalizeTemplate(String template) {
        Matcher matcher = SHORTHAND_VAR_PATTERN.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement = "[[${" + matcher.group(1).trim() + "}]]";
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
