package com.autoheal.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * All autoheal.* settings. Relative paths are resolved against the workspace root.
 */
@ConfigurationProperties(prefix = "autoheal")
public class AutoHealProperties {

    /** Root of the audited application. */
    private String workspacePath = ".";

    /** Where each orchestrator run writes its status snapshot. */
    private String statusFile = "agent_status.json";

    private final Model        model        = new Model();
    private final Logs         logs         = new Logs();
    private final Analysis     analysis     = new Analysis();
    private final Repair       repair       = new Repair();
    private final Learning     learning     = new Learning();
    private final Optimization optimization = new Optimization();

    public String getWorkspacePath()             { return workspacePath; }
    public void   setWorkspacePath(String v)     { this.workspacePath = v; }
    public String getStatusFile()                { return statusFile; }
    public void   setStatusFile(String v)        { this.statusFile = v; }

    public Model        getModel()        { return model; }
    public Logs         getLogs()         { return logs; }
    public Analysis     getAnalysis()     { return analysis; }
    public Repair       getRepair()       { return repair; }
    public Learning     getLearning()     { return learning; }
    public Optimization getOptimization() { return optimization; }

    // =========================================================================

    public static class Model {

        /** gemini | openai | ollama | disabled */
        private String backend = "gemini";

        private final Gemini gemini = new Gemini();
        private final OpenAi openai = new OpenAi();

        public String getBackend()          { return backend; }
        public void   setBackend(String v)  { this.backend = v; }
        public Gemini getGemini()           { return gemini; }
        public OpenAi getOpenai()           { return openai; }
    }

    public static class Gemini {
        private String apiKey;
        private String model   = "gemini-1.5-flash";
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";

        public String getApiKey()           { return apiKey; }
        public void   setApiKey(String v)   { this.apiKey = v; }
        public String getModel()            { return model; }
        public void   setModel(String v)    { this.model = v; }
        public String getBaseUrl()          { return baseUrl; }
        public void   setBaseUrl(String v)  { this.baseUrl = v; }
    }

    public static class OpenAi {
        private String apiKey;
        private String model      = "gpt-4";

        /** Unset means OPENAI_BASE_URL, then the hosted OpenAI API. */
        private String baseUrl;

        /** Model used instead of the default when the endpoint is a local inference server. */
        private String localModel = "llama2";

        public String getApiKey()              { return apiKey; }
        public void   setApiKey(String v)      { this.apiKey = v; }
        public String getModel()               { return model; }
        public void   setModel(String v)       { this.model = v; }
        public String getBaseUrl()             { return baseUrl; }
        public void   setBaseUrl(String v)     { this.baseUrl = v; }
        public String getLocalModel()          { return localModel; }
        public void   setLocalModel(String v)  { this.localModel = v; }
    }

    public static class Logs {
        private String debugFile   = "debug.log";
        private String errorFile   = "log/error.log";
        private int    windowHours = 24;

        /** How many errors are handed to the model for recommendations. */
        private int    sampleSize  = 5;

        public String getDebugFile()            { return debugFile; }
        public void   setDebugFile(String v)    { this.debugFile = v; }
        public String getErrorFile()            { return errorFile; }
        public void   setErrorFile(String v)    { this.errorFile = v; }
        public int    getWindowHours()          { return windowHours; }
        public void   setWindowHours(int v)     { this.windowHours = v; }
        public int    getSampleSize()           { return sampleSize; }
        public void   setSampleSize(int v)      { this.sampleSize = v; }
    }

    public static class Analysis {
        private int          longFunctionLines   = 50;
        private List<String> excludedDirectories = new ArrayList<>(List.of(
                "venv", ".venv", "env", "__pycache__", ".git", ".hg", ".svn", "node_modules",
                "build", "dist", "target", ".tox", ".mypy_cache", ".pytest_cache"));

        public int          getLongFunctionLines()                { return longFunctionLines; }
        public void         setLongFunctionLines(int v)           { this.longFunctionLines = v; }
        public List<String> getExcludedDirectories()              { return excludedDirectories; }
        public void         setExcludedDirectories(List<String> v){ this.excludedDirectories = v; }
    }

    public static class Repair {
        private String       backupDirectory       = "agent_backups";

        /** 0 keeps every backup. */
        private int          maxBackups            = 0;
        private String       dependencyManifest    = "requirements.txt";
        private int          maxLogRepairs         = 5;
        private List<String> dependencyScanCommand = new ArrayList<>(List.of(
                "pipreqs", ".", "--force", "--encoding=utf-8", "--ignore", ".venv,scripts,tests"));
        private int          commandTimeoutSeconds = 120;

        public String       getBackupDirectory()                   { return backupDirectory; }
        public void         setBackupDirectory(String v)           { this.backupDirectory = v; }
        public int          getMaxBackups()                        { return maxBackups; }
        public void         setMaxBackups(int v)                   { this.maxBackups = v; }
        public String       getDependencyManifest()                { return dependencyManifest; }
        public void         setDependencyManifest(String v)        { this.dependencyManifest = v; }
        public int          getMaxLogRepairs()                     { return maxLogRepairs; }
        public void         setMaxLogRepairs(int v)                { this.maxLogRepairs = v; }
        public List<String> getDependencyScanCommand()             { return dependencyScanCommand; }
        public void         setDependencyScanCommand(List<String> v){ this.dependencyScanCommand = v; }
        public int          getCommandTimeoutSeconds()             { return commandTimeoutSeconds; }
        public void         setCommandTimeoutSeconds(int v)        { this.commandTimeoutSeconds = v; }
    }

    public static class Learning {
        private String knowledgeFile  = "agent_knowledge.json";
        private double trustThreshold = 0.70;
        private int    insightLimit   = 5;

        public String getKnowledgeFile()            { return knowledgeFile; }
        public void   setKnowledgeFile(String v)    { this.knowledgeFile = v; }
        public double getTrustThreshold()           { return trustThreshold; }
        public void   setTrustThreshold(double v)   { this.trustThreshold = v; }
        public int    getInsightLimit()             { return insightLimit; }
        public void   setInsightLimit(int v)        { this.insightLimit = v; }
    }

    public static class Optimization {
        private List<String> outdatedDependencyCommand = new ArrayList<>(List.of("pip", "list", "--outdated"));

        public List<String> getOutdatedDependencyCommand()              { return outdatedDependencyCommand; }
        public void         setOutdatedDependencyCommand(List<String> v){ this.outdatedDependencyCommand = v; }
    }
}
