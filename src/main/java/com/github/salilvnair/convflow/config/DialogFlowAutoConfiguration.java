package com.github.salilvnair.convflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.convflow.engine.expression.ExpressionFactory;
import com.github.salilvnair.convflow.engine.expression.ScenarioFactory;
import com.github.salilvnair.convflow.engine.expression.spel.SpelExpressionFactory;
import com.github.salilvnair.convflow.engine.expression.template.ScenarioTemplateRenderer;
import com.github.salilvnair.convflow.engine.expression.template.TemplateScenarioFactory;
import com.github.salilvnair.convflow.engine.flow.DialogFlow;
import com.github.salilvnair.convflow.engine.hook.DialogTurnHook;
import com.github.salilvnair.convflow.engine.journal.JournalListener;
import com.github.salilvnair.convflow.engine.journal.LoggingJournalListener;
import com.github.salilvnair.convflow.engine.loader.DialogDefinitionLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.util.List;

@Slf4j
@AutoConfiguration
@ConditionalOnProperty(prefix = "convflow", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DialogFlowProperties.class)
public class DialogFlowAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ExpressionFactory convFlowExpressionFactory() {
        return new SpelExpressionFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScenarioTemplateRenderer scenarioTemplateRenderer() {
        return new ScenarioTemplateRenderer();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScenarioFactory convFlowScenarioFactory(ScenarioTemplateRenderer renderer) {
        return new TemplateScenarioFactory(renderer);
    }

    @Bean
    @ConditionalOnMissingBean
    public DialogDefinitionLoader dialogDefinitionLoader(ObjectProvider<ObjectMapper> objectMapper,
                                                         ExpressionFactory expressionFactory,
                                                         ScenarioFactory scenarioFactory) {
        return new DialogDefinitionLoader(
                objectMapper.getIfAvailable(ObjectMapper::new),
                expressionFactory,
                scenarioFactory
        );
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "convflow.journal", name = "log-events", havingValue = "true", matchIfMissing = true)
    public LoggingJournalListener loggingJournalListener() {
        return new LoggingJournalListener();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "convflow", name = "dialog-location")
    public DialogFlow dialogFlow(DialogFlowProperties properties,
                                 ResourceLoader resourceLoader,
                                 DialogDefinitionLoader loader,
                                 ObjectProvider<DialogTurnHook> turnHooks,
                                 ObjectProvider<JournalListener> journalListeners) {
        Resource resource = resourceLoader.getResource(properties.getDialogLocation());
        log.info("Loading dialog from {}", properties.getDialogLocation());
        List<DialogTurnHook> hooks = turnHooks.orderedStream().toList();
        List<JournalListener> listeners = journalListeners.orderedStream().toList();
        return new DialogFlow(loader.loadTree(resource), hooks, listeners);
    }
}
