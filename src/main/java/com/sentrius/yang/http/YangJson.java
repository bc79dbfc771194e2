package com.sentrius.yang.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public final class YangJson {

    private YangJson() {
    }

    public static ObjectMapper mapper() {
        return new ObjectMapper();
    }

    public static ObjectMapper prettyMapper() {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }
}
