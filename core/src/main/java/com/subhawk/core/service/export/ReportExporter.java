package com.subhawk.core.service.export;

import com.subhawk.core.model.ScanReport;

import java.io.IOException;
import java.nio.file.Path;

/** 스캔 리포트를 파일로 내보내는 책임 */
public interface ReportExporter {
    /**
     * @param report 완료(또는 취소)된 스캔 리포트
     * @param out    출력 파일. 상위 디렉터리가 없으면 만든다.
     * @return 기록한 파일 경로
     */
    Path export(ScanReport report, Path out) throws IOException;
}
