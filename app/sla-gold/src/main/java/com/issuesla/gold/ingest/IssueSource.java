package com.issuesla.gold.ingest;

import com.issuesla.gold.model.Issue;
import java.util.List;

/** 生の課題レコードを供給するソース (Bronze)。 */
public interface IssueSource {

  List<Issue> read();
}
