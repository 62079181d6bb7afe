package com.openforge.agentmemory.exception;

/**
 * The service is asked to do something its configuration cannot support.
 *
 * {@link Fault#CALLER}   - the request names something the deployment does not know
 *                          (e.g. an owner with no blob bucket mapping) → HTTP 400.
 * {@link Fault#DEPLOYER} - the deployment itself is inconsistent
 *                          (e.g. embedding vs. collection dimensionality) → HTTP 500.
 */
public class ConfigurationException extends RuntimeException {

    public enum Fault { CALLER, DEPLOYER }

    private final Fault fault;

    public ConfigurationException(Fault fault, String message) {
        super(message);
        this.fault = fault;
    }

    public static ConfigurationException caller(String message) {
        return new ConfigurationException(Fault.CALLER, message);
    }

    public static ConfigurationException deployer(String message) {
        return new ConfigurationException(Fault.DEPLOYER, message);
    }

    public Fault getFault() {
        return fault;
    }
}
