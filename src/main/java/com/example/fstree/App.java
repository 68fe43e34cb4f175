package com.example.fstree;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE =
            "Usage: java -jar fs-tree.jar <ls|rm|mkdirp|cp|cp-tree> <path> [<destination>]"
                    + " [--config=<config.json>] [--details] [--no-recursive]";

    private App() {
    }

    public static void main(String[] args) throws Exception {
        List<String> positional = new ArrayList<>();
        String configFile = null;
        boolean details = false;
        boolean recursive = true;
        for (String arg : args) {
            if (arg.startsWith("--config=")) {
                configFile = arg.substring("--config=".length());
            } else if (arg.equals("--details")) {
                details = true;
            } else if (arg.equals("--no-recursive")) {
                recursive = false;
            } else {
                positional.add(arg);
            }
        }
        if (positional.size() < 2) {
            LOGGER.error(USAGE);
            System.exit(1);
        }

        FileTreeConfig config = configFile == null
                ? FileTreeConfig.defaults()
                : new ConfigLoader().load(Path.of(configFile));
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        String command = positional.get(0);
        String target = positional.get(1);
        try (FileTree tree = new FileTree(config)) {
            Object result;
            switch (command) {
                case "ls" -> result = tree.list(target, recursive, details);
                case "rm" -> result = Map.of("removed", tree.removeTree(target, recursive));
                case "mkdirp" -> result = Map.of("created", tree.makeTreePath(target).stream().map(Path::toString).toList());
                case "cp", "cp-tree" -> {
                    if (positional.size() < 3) {
                        LOGGER.error(USAGE);
                        System.exit(1);
                        return;
                    }
                    result = command.equals("cp")
                            ? Map.of("bytes", tree.copyFile(target, positional.get(2)))
                            : Map.of("files", tree.copyTree(target, positional.get(2)));
                }
                default -> {
                    LOGGER.error("Unknown command {}. {}", command, USAGE);
                    System.exit(1);
                    return;
                }
            }
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (FileTreeException ex) {
            LOGGER.error("{} failed ({}): {}", command, ex.kind(), ex.getMessage());
            System.exit(2);
        }
    }
}
