package io.herald.core.job.bulk;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleEntry(
    @JsonProperty("cron_expr") @JsonAlias({"cron", "cronExpr"}) String cronExpr,
    @JsonProperty("tz") @JsonAlias({"timezone"}) String tz,
    @JsonProperty("every_seconds") @JsonAlias({"everySeconds"}) Long everySeconds,
    @JsonProperty("at") String at
) {
}
