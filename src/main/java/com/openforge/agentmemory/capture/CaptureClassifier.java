package com.openforge.agentmemory.capture;

import com.openforge.agentmemory.memory.MemoryCategory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a piece of conversational text is worth remembering, and as what.
 *
 * Two stages:
 *   1. gates   - reject noise and anything that looks like our own injected context
 *   2. triggers - the text must match at least one row of {@link CaptureTrigger#TABLE}
 *
 * Never throws: any input it cannot make sense of is simply not captured.
 */
@Component
public class CaptureClassifier {

    /** Wrapper emitted by auto-recall; text containing it is never re-captured. */
    public static final String INJECTED_MEMORY_MARKER = "<relevant-memories>";

    private static final Pattern PICTOGRAPH = Pattern.compile("[\\x{1F300}-\\x{1F9FF}]");

    private final CaptureProperties props;

    public CaptureClassifier(CaptureProperties props) {
        this.props = props;
    }

    public CaptureDecision classify(String text) {
        Optional<String> rejection = gate(text);
        if (rejection.isPresent()) {
            return CaptureDecision.reject(rejection.get());
        }
        if (!CaptureTrigger.anyMatches(text)) {
            return CaptureDecision.reject("No memory trigger matched");
        }
        return CaptureDecision.capture(CaptureTrigger.categoryOf(text).orElse(MemoryCategory.CONTEXT));
    }

    public boolean shouldCapture(String text) {
        return classify(text).capture();
    }

    /**
     * Runs the gate conditions only.
     *
     * @return the rejection reason, or empty when the text passes every gate
     */
    public Optional<String> gate(String text) {
        if (text == null) {
            return Optional.of("Content is empty");
        }
        if (text.length() < props.minLength()) {
            return Optional.of("Content too short (min %d characters)".formatted(props.minLength()));
        }
        if (text.length() > props.maxLength()) {
            return Optional.of("Content too long (max %d characters)".formatted(props.maxLength()));
        }
        if (text.contains(INJECTED_MEMORY_MARKER)) {
            return Optional.of("Content is an injected memory block");
        }
        if (text.startsWith("<") && text.contains("</")) {
            return Optional.of("Content looks like markup");
        }
        if (text.contains("**") && text.contains("\n-")) {
            return Optional.of("Content looks like a formatted list");
        }
        if (countPictographs(text) > props.maxPictographs()) {
            return Optional.of("Content has too many emoji");
        }
        return Optional.empty();
    }

    static int countPictographs(String text) {
        Matcher m = PICTOGRAPH.matcher(text);
        int count = 0;
        while (m.find()) count++;
        return count;
    }
}
