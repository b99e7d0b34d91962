package com.chicu.aifinetune.domain;

/**
 * Двухфазный итог: регистрация и выкладка фиксируются отдельно.
 * registered=true + deployed=false при success=false означает, что модель уже лежит в реестре,
 * а упала только выкладка.
 */
public record DeploymentOutcome(
        boolean registered,
        boolean deployed,
        String registeredModelId,
        String environment
) {
    public static DeploymentOutcome notRegistered() {
        return new DeploymentOutcome(false, false, null, null);
    }

    public static DeploymentOutcome registeredOnly(String modelId) {
        return new DeploymentOutcome(true, false, modelId, null);
    }

    public static DeploymentOutcome deployed(String modelId, String environment) {
        return new DeploymentOutcome(true, true, modelId, environment);
    }

    public static DeploymentOutcome deploymentFailed(String modelId, String environment) {
        return new DeploymentOutcome(true, false, modelId, environment);
    }
}
