package io.github.sparkrew.callflow.flow_extractor;

import java.util.List;

/**
 * Thrown when the requested entry class is not declared anywhere in the scanned tree.
 * The message lists a sample of the classes that were found.
 */
public class TargetNotFoundException extends RuntimeException {

    static final int SAMPLE_SIZE = 20;

    private final String target;
    private final List<String> availableSample;

    public TargetNotFoundException(String target, List<String> available) {
        super(messageFor(target, available));
        this.target = target;
        this.availableSample = List.copyOf(available.subList(0, Math.min(SAMPLE_SIZE, available.size())));
    }

    public String getTarget() {
        return target;
    }

    public List<String> getAvailableSample() {
        return availableSample;
    }

    private static String messageFor(String target, List<String> available) {
        String message = "Target class " + target + " was not found in the project";
        if (available.isEmpty()) {
            return message + ", no classes were cataloged";
        }
        String sample = String.join(", ", available.subList(0, Math.min(SAMPLE_SIZE, available.size())));
        if (available.size() > SAMPLE_SIZE) {
            sample += ", ... (" + available.size() + " in total)";
        }
        return message + ". Available classes: " + sample;
    }
}
