package io.clusterreconciler.clients;

import java.util.ArrayList;
import java.util.List;

/**
 * Placeholder substitution for configured command lines.
 */
final class CommandTemplates {
    
    static final String FLAKE_PLACEHOLDER = "{flake}";
    static final String NODE_PLACEHOLDER = "{node}";
    
    private CommandTemplates() {
    }
    
    static List<String> expand(List<String> template, String flake, String node) {
        List<String> command = new ArrayList<>(template.size());
        for (String argument : template) {
            String expanded = argument.replace(FLAKE_PLACEHOLDER, flake);
            if (node != null) {
                expanded = expanded.replace(NODE_PLACEHOLDER, node);
            }
            command.add(expanded);
        }
        return command;
    }
    
    static String lastLine(String output) {
        if (output == null || output.isBlank()) {
            return "no output";
        }
        String[] lines = output.strip().split("\\R");
        return lines[lines.length - 1];
    }
}
