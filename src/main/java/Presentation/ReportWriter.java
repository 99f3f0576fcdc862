package Presentation;

import Model.CurationResult;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ReportWriter {

    private final ObjectMapper mapper;

    public ReportWriter() {
        this(defaultMapper());
    }

    public ReportWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(CurationResult result) throws IOException {
        return mapper.writeValueAsString(result);
    }

    public void write(CurationResult result, OutputStream out) throws IOException {
        // stdout must stay open for whoever else writes to it
        mapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(out, result);
    }

    public void write(CurationResult result, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        mapper.writeValue(file.toFile(), result);
    }
}
