package ru.tigran.dialoguesimulator.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running record of one experiment.
 * Mutated once per completed or failed combination, then closed with {@link #complete(Instant)}.
 */
@Getter
@ToString
@JsonPropertyOrder({"test_mode", "start_time", "end_time", "total_planned", "total_successful",
        "total_failed", "planned", "successful", "failed"})
public class ExperimentResult {

    @JsonProperty("test_mode")
    private final boolean testMode;

    @JsonProperty("start_time")
    private final Instant startTime;

    @JsonProperty("end_time")
    private Instant endTime;

    private final List<Combination> planned;

    private final List<SuccessfulCombination> successful = new ArrayList<>();

    private final List<FailedCombination> failed = new ArrayList<>();

    public ExperimentResult(boolean testMode, Instant startTime, List<Combination> planned) {
        this.testMode = testMode;
        this.startTime = startTime;
        this.planned = List.copyOf(planned);
    }

    public void recordSuccess(SuccessfulCombination success) {
        successful.add(success);
    }

    public void recordFailure(FailedCombination failure) {
        failed.add(failure);
    }

    public void complete(Instant endTime) {
        this.endTime = endTime;
    }

    @JsonProperty("planned")
    public List<Combination> getPlanned() {
        return planned;
    }

    @JsonProperty("successful")
    public List<SuccessfulCombination> getSuccessful() {
        return Collections.unmodifiableList(successful);
    }

    @JsonProperty("failed")
    public List<FailedCombination> getFailed() {
        return Collections.unmodifiableList(failed);
    }

    @JsonProperty("total_planned")
    public int getTotalPlanned() {
        return planned.size();
    }

    @JsonProperty("total_successful")
    public int getTotalSuccessful() {
        return successful.size();
    }

    @JsonProperty("total_failed")
    public int getTotalFailed() {
        return failed.size();
    }

    @JsonIgnore
    public boolean isCompleted() {
        return endTime != null;
    }
}
