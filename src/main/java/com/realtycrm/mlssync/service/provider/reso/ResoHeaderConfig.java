package com.realtycrm.mlssync.service.provider.reso;

import com.realtycrm.mlssync.common.apiclient.model.HeaderConfig;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

/**
 * Headers every RESO Web API request carries.
 */
public class ResoHeaderConfig extends HeaderConfig {

    public ResoHeaderConfig() {
        addHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        addHeader("OData-Version", "4.0");
    }
}
