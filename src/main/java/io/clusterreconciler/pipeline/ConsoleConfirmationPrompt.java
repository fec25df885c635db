package io.clusterreconciler.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Interactive y/N prompt. Anything but "y" or "yes", end of input included, is a refusal.
 */
@Slf4j
public class ConsoleConfirmationPrompt implements ConfirmationPrompt {
    
    private final BufferedReader in;
    private final PrintStream out;
    
    public ConsoleConfirmationPrompt(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }
    
    @Override
    public boolean confirm(String question) {
        out.print(question + " (y/N): ");
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null) {
                log.info("No answer on standard input, treating as no");
                return false;
            }
            String normalized = answer.trim().toLowerCase();
            return normalized.equals("y") || normalized.equals("yes");
        } catch (IOException e) {
            log.warn("Failed to read confirmation: {}", e.getMessage());
            return false;
        }
    }
}
