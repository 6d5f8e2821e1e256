package com.acme.metadata.extractor.plan;

public sealed interface CompileResult permits CompileResult.Success, CompileResult.Failure {
    record Success(TraversalPlan plan) implements CompileResult {}
    record Failure(String code, String message, int position) implements CompileResult {}
}
