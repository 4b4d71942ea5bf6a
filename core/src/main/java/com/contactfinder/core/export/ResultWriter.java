package com.contactfinder.core.export;

import com.contactfinder.core.model.CrawlResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** 크롤 결과 목록을 파일로 내보내는 책임 (확장: CSV/JSON) */
public interface ResultWriter {
    /**
     * @param results 사이트 순서대로의 결과
     * @param out     출력 파일 (상위 디렉터리는 필요 시 생성)
     * @return 실제로 쓴 파일 경로
     */
    Path write(List<CrawlResult> results, Path out) throws IOException;

    /** 확장자 기준 선택: .json 이면 JSON, 그 외는 CSV */
    static ResultWriter forPath(Path out) {
        String name = (out == null || out.getFileName() == null) ? "" : out.getFileName().toString();
        return name.toLowerCase(java.util.Locale.ROOT).endsWith(".json")
                ? new JsonResultWriter()
                : new CsvResultWriter();
    }
}
