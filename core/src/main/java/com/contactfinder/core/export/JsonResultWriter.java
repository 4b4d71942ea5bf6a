package com.contactfinder.core.export;

import com.contactfinder.core.model.CrawlResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** JSON 내보내기: CSV 와 같은 행 구성, 리스트 필드는 배열 그대로 */
public class JsonResultWriter implements ResultWriter {

    private final ObjectMapper om = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public Path write(List<CrawlResult> results, Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        List<Map<String, Object>> rows = results.stream().map(JsonResultWriter::row).toList();
        om.writeValue(out.toFile(), rows);
        return out;
    }

    public static Map<String, Object> row(CrawlResult r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("site", r.getSite());
        m.put("emails", r.getEmails());
        m.put("phones", r.getPhones());
        m.put("contact_pages_checked", r.getContactPagesChecked());
        m.put("outcome", r.getOutcome().name());
        m.put("skipped_contact_pages", r.getSkippedContactPages());
        m.put("error", r.getError());
        return m;
    }
}
