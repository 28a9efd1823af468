package org.opensearch.migrations.graphsync.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.opensearch.migrations.graphsync.pipeline.exceptions.SyncConfigurationException;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * The YAML configuration file, with snake_case keys. Every value is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConfigFile {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    @JsonProperty("memgraph")
    public Memgraph memgraph = new Memgraph();

    @JsonProperty("opensearch")
    public OpenSearch opensearch = new OpenSearch();

    @JsonProperty("index_spec_file")
    public String indexSpecFile;

    @JsonProperty("clear_existing_indices")
    public Boolean clearExistingIndices;

    @JsonProperty("allow_index_creation")
    public Boolean allowIndexCreation;

    @JsonProperty("selected_indices")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    public List<String> selectedIndices;

    @JsonProperty("test_mode")
    public Boolean testMode;

    @JsonProperty("default_page_size")
    public Integer defaultPageSize;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Memgraph {
        @JsonProperty("host")
        public String host;
        @JsonProperty("port")
        public Integer port;
        @JsonProperty("username")
        public String username;
        @JsonProperty("password")
        public String password;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OpenSearch {
        @JsonProperty("host")
        public String host;
        @JsonProperty("use_ssl")
        public Boolean useSsl;
        @JsonProperty("verify_certs")
        public Boolean verifyCerts;
        @JsonProperty("username")
        public String username;
        @JsonProperty("password")
        public String password;
    }

    public static ConfigFile load(Path path) {
        try {
            var tree = YAML_MAPPER.readTree(path.toFile());
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                return new ConfigFile();
            }
            var loaded = YAML_MAPPER.treeToValue(tree, ConfigFile.class);
            if (loaded.memgraph == null) {
                loaded.memgraph = new Memgraph();
            }
            if (loaded.opensearch == null) {
                loaded.opensearch = new OpenSearch();
            }
            return loaded;
        } catch (IOException e) {
            throw new SyncConfigurationException("Unable to read configuration file " + path + ": "
                + e.getMessage(), e);
        }
    }
}
