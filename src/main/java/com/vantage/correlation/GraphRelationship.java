package com.vantage.correlation;

import java.util.List;
import java.util.Objects;

/**
 * An outgoing relationship as stored in the graph store.
 *
 * The score is nullable: some stores do not record one, and the walker applies
 * its {@link MissingScorePolicy} to such edges.
 */
public class GraphRelationship {

    private final String sourceId;
    private final String targetId;
    private final String relationshipType;
    private final Double score;
    private final List<String> evidence;

    public GraphRelationship(String sourceId, String targetId, String relationshipType,
                             Double score, List<String> evidence) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.relationshipType = relationshipType;
        this.score = score;
        this.evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getRelationshipType() {
        return relationshipType;
    }

    public Double getScore() {
        return score;
    }

    public List<String> getEvidence() {
        return evidence;
    }

    @Override
    public String toString() {
        return sourceId + "-[" + relationshipType + ":" + score + "]->" + targetId;
    }
}
