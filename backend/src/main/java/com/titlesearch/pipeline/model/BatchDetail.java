package com.titlesearch.pipeline.model;

import java.util.List;

public record BatchDetail(BatchUpload batch, List<BatchItem> items) {
}
