package com.di.martflow.pipeline;

import com.di.martflow.query.QueryRunReport;
import lombok.Value;

@Value
public class FullRunOutcome {
    EtlOutcome etl;
    QueryRunReport queries;
}
