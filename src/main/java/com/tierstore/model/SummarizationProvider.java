package com.tierstore.model;

public interface SummarizationProvider {

    String modelId();

    Summary summarize(SummaryRequest request) throws ProviderException;
}
