package dev.campfire.job;

import dev.campfire.validation.ExtractedRecord;
import java.util.List;
import java.util.Objects;

/**
 * Raw collaborator output kept on the job for auditing, stored as JSON.
 *
 * @param records records exactly as received, before validation
 * @param logs the collaborator's log lines
 */
public record JobOutput(List<ExtractedRecord> records, List<String> logs) {

  public JobOutput {
    records = records == null ? List.of() : records.stream().filter(Objects::nonNull).toList();
    logs = logs == null ? List.of() : logs.stream().filter(Objects::nonNull).toList();
  }
}
