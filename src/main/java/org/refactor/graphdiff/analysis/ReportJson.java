package org.refactor.graphdiff.analysis;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 报告 / 图快照的 JSON 序列化（字段名转成 snake_case）。
 */
public final class ReportJson {

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) {
            super(msg, cause);
        }
    }

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    private ReportJson() {
    }

    public static String toJson(Object value) {
        return GSON.toJson(value);
    }

    public static void write(Object value, Path file) {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(value, w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }
}
