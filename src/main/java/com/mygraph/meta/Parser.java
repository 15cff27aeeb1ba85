package com.mygraph.meta;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class Parser {
    private final String filePath;
    private final ObjectMapper yamlMapper;

    public Parser(String filePath) {
        this.filePath = filePath;
        // 字段名使用 snake_case，由字段上的 @JsonProperty 决定
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public SchemaDocument parse() throws IOException {
        File file = new File(filePath);
        if (!file.exists()) {
            throw new IOException("schema file not found: " + filePath);
        }
        return yamlMapper.readValue(file, SchemaDocument.class);
    }

    public SchemaDocument parse(InputStream in) throws IOException {
        return yamlMapper.readValue(in, SchemaDocument.class);
    }
}
