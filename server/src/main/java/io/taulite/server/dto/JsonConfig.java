package io.taulite.server.dto;

/**
 * Server settings file loaded with --config. Absent fields keep their
 * defaults; command-line flags win over the file.
 */
public class JsonConfig {
    public Integer port;
    public String dataDir;
    public String backend;
    public Integer catalogCapacity;
    public Integer snapshotEvery;
    public Integer maxPayloadBytes;
}
