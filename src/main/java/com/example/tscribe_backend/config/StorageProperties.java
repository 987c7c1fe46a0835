package com.example.tscribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String jobsPrefix = "jobs";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getJobsPrefix() { return jobsPrefix; }
    public void setJobsPrefix(String jobsPrefix) { this.jobsPrefix = jobsPrefix; }
}
