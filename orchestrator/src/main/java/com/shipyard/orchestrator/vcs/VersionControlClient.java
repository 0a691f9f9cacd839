package com.shipyard.orchestrator.vcs;

/**
 * Version-control collaborator: knows a project's current ref and can roll
 * the project's working state back to an earlier one.
 */
public interface VersionControlClient {

    void restoreTo(String projectId, String ref);

    String currentRef(String projectId);
}
