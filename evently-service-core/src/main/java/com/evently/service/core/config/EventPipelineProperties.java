package com.evently.service.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "evently.events")
public class EventPipelineProperties {

    /** Event definitions resource: a filesystem path, else a classpath resource of the same name. */
    private String definitionsFile = "event_definitions.yaml";

    /** Drop notifications no definition matches, instead of converting them with the default traits only. */
    private boolean allowDroppingOfNotifications = false;

    private boolean storeEvents = true;

    public String getDefinitionsFile() {
        return definitionsFile;
    }

    public void setDefinitionsFile(String definitionsFile) {
        this.definitionsFile = definitionsFile;
    }

    public boolean isAllowDroppingOfNotifications() {
        return allowDroppingOfNotifications;
    }

    public void setAllowDroppingOfNotifications(boolean allowDroppingOfNotifications) {
        this.allowDroppingOfNotifications = allowDroppingOfNotifications;
    }

    public boolean isStoreEvents() {
        return storeEvents;
    }

    public void setStoreEvents(boolean storeEvents) {
        this.storeEvents = storeEvents;
    }
}
