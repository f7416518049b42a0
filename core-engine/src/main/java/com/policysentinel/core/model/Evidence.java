package com.policysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.Objects;

/**
 * Structured context attached to an {@link Issue}.
 *
 * <p>
 * Every evidence record names the file the finding was made in. The other
 * fields are populated where they apply: the document location (e.g.
 * {@code conversions[2].matrix_id}), the policy, matrix, layout and speaker
 * identifiers involved, and the offending numeric value.
 * </p>
 *
 * <p>
 * Instances are immutable. Use {@link #builder()} or {@link #toBuilder()}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "file_path", "location", "policy_id", "matrix_id", "layout_id",
        "target_speaker", "source_speaker", "value" })
public final class Evidence {

    /**
     * Orders evidence by file path, matrix, target speaker and source speaker,
     * then by the remaining fields so that the order is total.
     */
    static final Comparator<Evidence> ORDER = Comparator
            .comparing(Evidence::getFilePath, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Evidence::getMatrixId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Evidence::getTargetSpeaker, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Evidence::getSourceSpeaker, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Evidence::getLocation, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Evidence::getPolicyId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Evidence::getLayoutId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Evidence::getValue, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final String filePath;
    private final String location;
    private final String policyId;
    private final String matrixId;
    private final String layoutId;
    private final String targetSpeaker;
    private final String sourceSpeaker;
    private final Double value;

    private Evidence(Builder builder) {
        this.filePath = Objects.requireNonNull(builder.filePath, "filePath must not be null");
        this.location = builder.location;
        this.policyId = builder.policyId;
        this.matrixId = builder.matrixId;
        this.layoutId = builder.layoutId;
        this.targetSpeaker = builder.targetSpeaker;
        this.sourceSpeaker = builder.sourceSpeaker;
        this.value = builder.value;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder pre-populated with this evidence, for deriving a more
     * specific record from a shared context.
     *
     * @return builder holding a copy of every field
     */
    public Builder toBuilder() {
        return new Builder()
                .filePath(filePath)
                .location(location)
                .policyId(policyId)
                .matrixId(matrixId)
                .layoutId(layoutId)
                .targetSpeaker(targetSpeaker)
                .sourceSpeaker(sourceSpeaker)
                .value(value);
    }

    /**
     * Fluent builder for {@link Evidence}. {@code filePath} is required.
     */
    public static class Builder {
        private String filePath;
        private String location;
        private String policyId;
        private String matrixId;
        private String layoutId;
        private String targetSpeaker;
        private String sourceSpeaker;
        private Double value;

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder policyId(String policyId) {
            this.policyId = policyId;
            return this;
        }

        public Builder matrixId(String matrixId) {
            this.matrixId = matrixId;
            return this;
        }

        public Builder layoutId(String layoutId) {
            this.layoutId = layoutId;
            return this;
        }

        public Builder targetSpeaker(String targetSpeaker) {
            this.targetSpeaker = targetSpeaker;
            return this;
        }

        public Builder sourceSpeaker(String sourceSpeaker) {
            this.sourceSpeaker = sourceSpeaker;
            return this;
        }

        public Builder value(Double value) {
            this.value = value;
            return this;
        }

        /**
         * @return a new {@link Evidence}
         * @throws NullPointerException if {@code filePath} is {@code null}
         */
        public Evidence build() {
            return new Evidence(this);
        }
    }

    @JsonProperty("file_path")
    public String getFilePath() {
        return filePath;
    }

    @JsonProperty("location")
    public String getLocation() {
        return location;
    }

    @JsonProperty("policy_id")
    public String getPolicyId() {
        return policyId;
    }

    @JsonProperty("matrix_id")
    public String getMatrixId() {
        return matrixId;
    }

    @JsonProperty("layout_id")
    public String getLayoutId() {
        return layoutId;
    }

    @JsonProperty("target_speaker")
    public String getTargetSpeaker() {
        return targetSpeaker;
    }

    @JsonProperty("source_speaker")
    public String getSourceSpeaker() {
        return sourceSpeaker;
    }

    @JsonProperty("value")
    public Double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Evidence that))
            return false;
        return filePath.equals(that.filePath)
                && Objects.equals(location, that.location)
                && Objects.equals(policyId, that.policyId)
                && Objects.equals(matrixId, that.matrixId)
                && Objects.equals(layoutId, that.layoutId)
                && Objects.equals(targetSpeaker, that.targetSpeaker)
                && Objects.equals(sourceSpeaker, that.sourceSpeaker)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePath, location, policyId, matrixId, layoutId,
                targetSpeaker, sourceSpeaker, value);
    }

    @Override
    public String toString() {
        return "Evidence{" +
                "filePath='" + filePath + '\'' +
                ", location='" + location + '\'' +
                ", policyId='" + policyId + '\'' +
                ", matrixId='" + matrixId + '\'' +
                ", layoutId='" + layoutId + '\'' +
                ", targetSpeaker='" + targetSpeaker + '\'' +
                ", sourceSpeaker='" + sourceSpeaker + '\'' +
                ", value=" + value +
                '}';
    }
}
