package org.chillsense.lsp;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Values the language server reports to clients.
 *
 * @param name               The server name sent in {@code serverInfo}.
 * @param version            The server version sent in {@code serverInfo}.
 * @param triggerCharacters  Characters that make the client request completion.
 */
public record ServerSettings(String name, String version, List<String> triggerCharacters) {

    public ServerSettings {
        triggerCharacters = List.copyOf(triggerCharacters);
    }

    /**
     * Reads the settings from the {@code chillsense} section of the application config.
     * @param config The resolved application config.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static ServerSettings fromConfig(Config config) {
        Config section = config.getConfig("chillsense");
        return new ServerSettings(
                section.getString("server.name"),
                section.getString("server.version"),
                section.getStringList("completion.trigger-characters"));
    }
}
