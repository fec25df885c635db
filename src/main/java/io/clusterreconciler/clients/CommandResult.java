package io.clusterreconciler.clients;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Exit status and combined output of one external command.
 */
@Getter
@ToString
@AllArgsConstructor
public class CommandResult {
    
    private final int exitCode;
    
    private final String output;
    
    // killed after its timeout elapsed; exitCode is then meaningless
    private final boolean timedOut;
    
    public static CommandResult timeout(String output) {
        return new CommandResult(-1, output, true);
    }
    
    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }
}
