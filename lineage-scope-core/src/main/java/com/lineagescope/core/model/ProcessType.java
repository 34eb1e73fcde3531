package com.lineagescope.core.model;

/**
 * Kind of top-level definition a process was built from.
 */
public enum ProcessType {
    /** Graph definition (Ab Initio .mp) */
    GRAPH,

    /** Workflow definition (Oozie workflow.xml, workflow directory) */
    WORKFLOW,

    /** Scheduling definition wrapping workflows (Oozie coordinator) */
    COORDINATOR,

    /** Notebook (Databricks source export or .ipynb) */
    NOTEBOOK,

    /** Orchestrated pipeline (Azure Data Factory) */
    PIPELINE,

    UNKNOWN
}
