package com.assessorai.domain.pipeline.service;

import com.assessorai.domain.pipeline.model.StageId;

/**
 * Source of the opaque, versioned instruction text sent as the system message of each stage.
 */
public interface InstructionSetProvider {

    InstructionSet loadInstructions(StageId stageId, String profile);

    record InstructionSet(String text, String version) {}
}
