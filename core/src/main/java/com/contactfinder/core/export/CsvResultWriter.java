package com.contactfinder.core.export;

import com.contactfinder.core.model.CrawlResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * CSV 내보내기: 결과 1건 = 1행.
 * 리스트 필드는 "; " 로 join (기존 산출물과의 호환 형식이므로 바꾸지 않는다).
 */
public class CsvResultWriter implements ResultWriter {

    public static final String LIST_DELIMITER = "; ";
    static final String HEADER = "site,emails,phones,contact_pages_checked,error";

    @Override
    public Path write(List<CrawlResult> results, Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            w.write(HEADER);
            w.write("\r\n");
            for (CrawlResult r : results) {
                w.write(row(r));
                w.write("\r\n");
            }
        }
        return out;
    }

    static String row(CrawlResult r) {
        return csv(r.getSite()) + ","
                + csv(String.join(LIST_DELIMITER, r.getEmails())) + ","
                + csv(String.join(LIST_DELIMITER, r.getPhones())) + ","
                + csv(String.join(LIST_DELIMITER, r.getContactPagesChecked())) + ","
                + csv(r.getError());
    }

    // 필요할 때만 따옴표 (쉼표/따옴표/개행)
    static String csv(String v) {
        if (v == null) return "";
        boolean quote = v.indexOf(',') >= 0 || v.indexOf('"') >= 0
                || v.indexOf('\n') >= 0 || v.indexOf('\r') >= 0;
        if (!quote) return v;
        return "\"" + v.replace("\"", "\"\"") + "\"";
    }
}
