package com.netcourier.rag.service.query;

import com.netcourier.rag.model.QueryRequest;
import com.netcourier.rag.model.QueryResponse;

public interface QueryOrchestrator {

    QueryResponse answer(QueryRequest request);
}
