package com.realtycrm.mlssync.common.apiclient.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Static headers sent with every request of a client. Subclasses declare the headers a protocol requires.
 */
@Getter
@Setter
public abstract class HeaderConfig {

    private List<Header> headers = new ArrayList<>();

    protected void addHeader(String name, String value) {
        headers.add(new Header(name, value));
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Header {

        private String name;
        private String value;
    }
}
