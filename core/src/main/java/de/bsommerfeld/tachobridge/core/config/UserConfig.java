package de.bsommerfeld.tachobridge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-specific preferences. Controls the language of every status and
 * error message shown to the user.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserConfig {

    @JsonProperty("language")
    private String language = "nl";

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }
}
