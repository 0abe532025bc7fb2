package com.issuesla.gold.report;

import com.issuesla.gold.model.ClassificationResult;
import com.issuesla.gold.model.SlaReports;
import java.nio.file.Path;
import java.util.List;

/** 分類済み課題と集計レポートの出力先 (Gold)。 */
public interface ReportSink {

  List<Path> write(ClassificationResult result, SlaReports reports);
}
