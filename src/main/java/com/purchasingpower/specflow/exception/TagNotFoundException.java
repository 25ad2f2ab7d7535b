package com.purchasingpower.specflow.exception;

/**
 * A TAG id is not present in the plan.md TAG chain.
 */
public class TagNotFoundException extends TaskStatusException {

    public TagNotFoundException(String tagId, String where) {
        super("TAG " + tagId + " not found in " + where, tagId);
    }

}
