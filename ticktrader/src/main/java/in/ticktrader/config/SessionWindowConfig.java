package in.ticktrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Trading session window and daily limits.
 */
public record SessionWindowConfig(
    @JsonProperty("timezone")
    String timezone,             // e.g. "Asia/Kolkata"

    @JsonProperty("startTime")
    String startTime,            // "HH:mm"

    @JsonProperty("endTime")
    String endTime,              // "HH:mm"

    @JsonProperty("startBufferMinutes")
    Integer startBufferMinutes,  // no entries this long after start

    @JsonProperty("endBufferMinutes")
    Integer endBufferMinutes,    // positions flattened this long before end

    @JsonProperty("noTradeStartMinutes")
    Integer noTradeStartMinutes,

    @JsonProperty("noTradeEndMinutes")
    Integer noTradeEndMinutes,

    @JsonProperty("maxTradesPerDay")
    Integer maxTradesPerDay
) {
    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    public LocalTime start() {
        return LocalTime.parse(startTime);
    }

    public LocalTime end() {
        return LocalTime.parse(endTime);
    }
}
