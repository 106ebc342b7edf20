package com.briefforge.orchestrator.synthesis;

public class SynthesizerNotFoundException extends RuntimeException {
    public SynthesizerNotFoundException(String name) {
        super("No synthesizer registered with name: " + name);
    }
}
