package com.promptguard.pipeline;

public enum PipelineAction {
    ALLOW,
    BLOCK
}
