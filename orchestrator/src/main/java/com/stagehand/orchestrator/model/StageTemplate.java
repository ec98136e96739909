package com.stagehand.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * One configurable step of a project's pipeline.
 *
 * DB table: stage_templates (per-project database)
 *
 * {@code allowedTools == null} means the agent gets its full tool set.
 */
public class StageTemplate {

    private String        id;
    private String        projectId;
    private String        name;
    private String        description = "";
    private int           sortOrder;
    private String        promptTemplate = "";
    private InputSource   inputSource = InputSource.USER;
    private OutputFormat  outputFormat = OutputFormat.TEXT;
    private String        outputSchema;
    private GateRule      gateRule = GateRule.approval();
    private String        personaName;
    private String        personaSystemPrompt;
    private String        personaModel;
    private String        preparationPrompt;
    private List<String>  allowedTools;
    private ResultMode    resultMode = ResultMode.REPLACE;

    // Behavior flags, fired as side effects when the stage is approved.
    private boolean       commitsChanges;
    private String        commitPrefix;
    private boolean       createsPr;
    private boolean       terminal;
    private boolean       triggersStageSelection;
    private boolean       requiresUserInput;

    private String        agent;
    private Instant       createdAt;
    private Instant       updatedAt;

    public StageTemplate() {}

    public StageTemplate(String id, String projectId, String name, int sortOrder) {
        this.id        = id;
        this.projectId = projectId;
        this.name      = name;
        this.sortOrder = sortOrder;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String       getId()                  { return id; }
    public String       getProjectId()           { return projectId; }
    public String       getName()                { return name; }
    public String       getDescription()         { return description; }
    public int          getSortOrder()           { return sortOrder; }
    public String       getPromptTemplate()      { return promptTemplate; }
    public InputSource  getInputSource()         { return inputSource; }
    public OutputFormat getOutputFormat()        { return outputFormat; }
    public String       getOutputSchema()        { return outputSchema; }
    public GateRule     getGateRule()            { return gateRule; }
    public String       getPersonaName()         { return personaName; }
    public String       getPersonaSystemPrompt() { return personaSystemPrompt; }
    public String       getPersonaModel()        { return personaModel; }
    public String       getPreparationPrompt()   { return preparationPrompt; }
    public List<String> getAllowedTools()        { return allowedTools; }
    public ResultMode   getResultMode()          { return resultMode; }
    public boolean      isCommitsChanges()       { return commitsChanges; }
    public String       getCommitPrefix()        { return commitPrefix; }
    public boolean      isCreatesPr()            { return createsPr; }
    public boolean      isTerminal()             { return terminal; }
    public boolean      isTriggersStageSelection() { return triggersStageSelection; }
    public boolean      isRequiresUserInput()    { return requiresUserInput; }
    public String       getAgent()               { return agent; }
    public Instant      getCreatedAt()           { return createdAt; }
    public Instant      getUpdatedAt()           { return updatedAt; }

    public void setId(String id)                                  { this.id = id; }
    public void setProjectId(String projectId)                    { this.projectId = projectId; }
    public void setName(String name)                              { this.name = name; }
    public void setDescription(String description)                { this.description = description; }
    public void setSortOrder(int sortOrder)                       { this.sortOrder = sortOrder; }
    public void setPromptTemplate(String promptTemplate)          { this.promptTemplate = promptTemplate; }
    public void setInputSource(InputSource inputSource)           { this.inputSource = inputSource; }
    public void setOutputFormat(OutputFormat outputFormat)        { this.outputFormat = outputFormat; }
    public void setOutputSchema(String outputSchema)              { this.outputSchema = outputSchema; }
    public void setGateRule(GateRule gateRule)                    { this.gateRule = gateRule; }
    public void setPersonaName(String personaName)                { this.personaName = personaName; }
    public void setPersonaSystemPrompt(String prompt)             { this.personaSystemPrompt = prompt; }
    public void setPersonaModel(String personaModel)              { this.personaModel = personaModel; }
    public void setPreparationPrompt(String preparationPrompt)    { this.preparationPrompt = preparationPrompt; }
    public void setAllowedTools(List<String> allowedTools)        { this.allowedTools = allowedTools; }
    public void setResultMode(ResultMode resultMode)              { this.resultMode = resultMode; }
    public void setCommitsChanges(boolean commitsChanges)         { this.commitsChanges = commitsChanges; }
    public void setCommitPrefix(String commitPrefix)              { this.commitPrefix = commitPrefix; }
    public void setCreatesPr(boolean createsPr)                   { this.createsPr = createsPr; }
    public void setTerminal(boolean terminal)                     { this.terminal = terminal; }
    public void setTriggersStageSelection(boolean triggers)       { this.triggersStageSelection = triggers; }
    public void setRequiresUserInput(boolean requiresUserInput)   { this.requiresUserInput = requiresUserInput; }
    public void setAgent(String agent)                            { this.agent = agent; }
    public void setCreatedAt(Instant t)                           { this.createdAt = t; }
    public void setUpdatedAt(Instant t)                           { this.updatedAt = t; }
}
