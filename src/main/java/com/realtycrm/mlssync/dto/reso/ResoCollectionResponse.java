package com.realtycrm.mlssync.dto.reso;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * OData collection envelope returned by RESO Web API resources.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResoCollectionResponse {

    @JsonProperty("value")
    private List<Map<String, Object>> value = new ArrayList<>();

    @JsonProperty("@odata.nextLink")
    private String nextLink;

    @JsonProperty("@odata.count")
    private Long count;
}
