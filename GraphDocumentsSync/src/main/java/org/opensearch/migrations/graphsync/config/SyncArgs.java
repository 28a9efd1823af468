package org.opensearch.migrations.graphsync.config;

import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

/**
 * Command line of the sync tool. Every option may also come from an {@code OS_LOADER_} environment variable
 * or from the YAML config file; unset options are left null so the resolver can tell them apart.
 */
public class SyncArgs {
    @Parameter(
        names = {"--help", "-h"},
        help = true,
        description = "Displays information about how to use this tool")
    public boolean help;

    @Parameter(names = {"--verbose", "-v"},
        description = "Log at DEBUG level")
    public boolean verbose;

    @Parameter(names = {"--config"},
        description = "Path to the YAML configuration file. Default: ./config.yaml when it exists")
    public String config;

    @ParametersDelegate
    public MemgraphArgs memgraph = new MemgraphArgs();

    @ParametersDelegate
    public OpenSearchArgs opensearch = new OpenSearchArgs();

    @Parameter(names = {"--index-spec-file", "--indexSpecFile"},
        description = "Path to the YAML file declaring the indices to sync")
    public String indexSpecFile;

    @Parameter(names = {"--clear-existing-indices", "--clearExistingIndices"},
        description = "Delete each index before loading it. Default: false")
    public Boolean clearExistingIndices;

    @Parameter(names = {"--no-clear-existing-indices", "--noClearExistingIndices"},
        description = "Keep existing indices and their documents")
    public Boolean noClearExistingIndices;

    @Parameter(names = {"--allow-index-creation", "--allowIndexCreation"},
        description = "Create missing indices. Default: true")
    public Boolean allowIndexCreation;

    @Parameter(names = {"--no-allow-index-creation", "--noAllowIndexCreation"},
        description = "Fail an index that does not exist instead of creating it")
    public Boolean noAllowIndexCreation;

    @Parameter(names = {"--selected-indices", "--selectedIndices"},
        description = "Comma-separated index names; only these indices are synced. Default: all")
    public List<String> selectedIndices;

    @Parameter(names = {"--test-mode", "--testMode"},
        description = "Run only the first page of every query, to check that all queries work")
    public Boolean testMode;

    @Parameter(names = {"--default-page-size", "--defaultPageSize"},
        description = "Rows per page for queries without a page_size. Default: 1000")
    public Integer defaultPageSize;
}
