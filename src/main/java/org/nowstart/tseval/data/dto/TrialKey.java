package org.nowstart.tseval.data.dto;

public record TrialKey(
        String datasetId,
        String algorithmName
) {

    public TrialKey {
        if (datasetId == null || algorithmName == null) {
            throw new IllegalArgumentException("datasetId and algorithmName are required");
        }
    }

    @Override
    public String toString() {
        return algorithmName + "@" + datasetId;
    }
}
