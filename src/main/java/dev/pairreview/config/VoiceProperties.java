package dev.pairreview.config;

import dev.pairreview.domain.enums.VoiceTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Provider CLIs a voice can run on. Each arg may contain the {@code {model}} placeholder.
 */
@ConfigurationProperties(prefix = "pairreview.voices")
public record VoiceProperties(String defaultProvider, String defaultModel, VoiceTier defaultTier,
                              Map<String, ProviderCommand> providers) {
    public VoiceProperties {
        if (defaultProvider == null) defaultProvider = "claude";
        if (defaultModel == null) defaultModel = "sonnet";
        if (defaultTier == null) defaultTier = VoiceTier.BALANCED;
        providers = providers == null ? Map.of() : Map.copyOf(providers);
    }

    public record ProviderCommand(String command, List<String> args, Map<String, String> env) {
        public ProviderCommand {
            if (command == null || command.isBlank())
                throw new IllegalArgumentException("provider command is required");
            args = args == null ? List.of() : List.copyOf(args);
            env = env == null ? Map.of() : Map.copyOf(env);
        }

        public List<String> commandLine(String model) {
            List<String> line = new ArrayList<>(args.size() + 1);
            line.add(command);
            args.forEach(arg -> line.add(arg.replace("{model}", model)));
            return line;
        }
    }
}
