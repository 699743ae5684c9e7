package org.nowstart.tseval.data.exception;

import lombok.Getter;

@Getter
public class DuplicateAlgorithmException extends EvaluationException {

    private final String algorithmName;

    public DuplicateAlgorithmException(String algorithmName) {
        super("duplicate_algorithm", "Duplicate algorithm registered for name=" + algorithmName);
        this.algorithmName = algorithmName;
    }
}
