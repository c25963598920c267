package com.resumeai.domain.rewrite.model;

/**
 * A question for the candidate when the ledger cannot ground an improvement.
 */
public record UserInputRequest(String prompt, String exampleAnswer) {
}
