package io.clusterreconciler.enums;

/**
 * Pipeline phases that produce per-node results.
 */
public enum PipelinePhase {
    VALIDATE("validate"),
    ARTIFACT("artifact"),
    DECOMMISSION("decommission"),
    EVALUATE("evaluate"),
    DEPLOY("deploy"),
    VERIFY("verify");
    
    private final String value;
    
    PipelinePhase(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
}
