package teranet.mapdev.preprocess.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted state of a fitted datetime formatter.
 * Written between the fit run and later convert / reverse-convert runs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatetimeFormatterState {

    @JsonProperty("datetime_columns")
    private List<String> datetimeColumns = new ArrayList<>();

    @JsonProperty("datetime_formats")
    private Map<String, String> datetimeFormats = new LinkedHashMap<>();

    @JsonProperty("dead_columns")
    private List<String> deadColumns = new ArrayList<>();

    @JsonProperty("fitted")
    private boolean fitted;
}
