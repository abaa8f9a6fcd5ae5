package com.github.salilvnair.convflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "convflow")
@Getter
@Setter
public class DialogFlowProperties {

    private boolean enabled = true;

    /**
     * Spring resource location of the JSON dialog, e.g. {@code classpath:dialog.json}.
     * A {@code DialogFlow} bean is created only when it is set.
     */
    private String dialogLocation;

    private Journal journal = new Journal();

    @Getter
    @Setter
    public static class Journal {
        private boolean logEvents = true;
    }
}
