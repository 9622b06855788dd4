package de.mirkosertic.mediashrink.verifier;

import java.util.List;

/**
 * @param failures one message per failed check, naming measured and expected values
 * @param warnings checks that could not be performed
 */
public record VerificationResult(List<String> failures, List<String> warnings) {

    public VerificationResult {
        failures = List.copyOf(failures);
        warnings = List.copyOf(warnings);
    }

    public boolean passed() {
        return failures.isEmpty();
    }

    public String failureMessage() {
        return String.join("; ", failures);
    }
}
