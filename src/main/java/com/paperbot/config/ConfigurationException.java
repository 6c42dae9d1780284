package com.paperbot.config;

import com.paperbot.core.PaperBotException;

public class ConfigurationException extends PaperBotException {

    public ConfigurationException(String message) {
        super(message);
    }
}
