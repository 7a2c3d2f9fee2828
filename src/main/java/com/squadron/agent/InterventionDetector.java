package com.squadron.agent;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognises assistant text that blocks on the operator: a trailing question, a request
 * for approval, or a request for input. A process whose output matches moves to
 * {@link AgentState#WAITING} until input is sent.
 */
public class InterventionDetector {

    private static final List<Pattern> PATTERNS = List.of(
            // trailing question
            Pattern.compile("\\?\\s*$"),
            // approval
            Pattern.compile("waiting for (?:your )?(?:approval|confirmation|permission)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:do you want me to|should I proceed|shall I continue)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:is this okay|is that okay|is this acceptable)", Pattern.CASE_INSENSITIVE),
            // input
            Pattern.compile("please (?:enter|provide|specify|type|give)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("waiting for (?:user )?input", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:input required|user input needed)", Pattern.CASE_INSENSITIVE)
    );

    public boolean requiresInput(AgentOutput output) {
        if (output.type() != AgentOutputType.TEXT || output.content().isBlank()) {
            return false;
        }
        String content = output.content();
        for (Pattern pattern : PATTERNS) {
            if (pattern.matcher(content).find()) {
                return true;
            }
        }
        return false;
    }
}
