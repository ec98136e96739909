package com.stagehand.orchestrator.template;

/**
 * JSON schemas handed to the agent for structured stage formats. The
 * matching payload records live in {@code model.output}.
 */
public final class OutputSchemas {

    private OutputSchemas() {}

    public static final String RESEARCH = """
            {
              "type": "object",
              "properties": {
                "research": {
                  "type": "string"
                },
                "questions": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "id": {
                        "type": "string"
                      },
                      "question": {
                        "type": "string"
                      },
                      "proposed_answer": {
                        "type": "string"
                      },
                      "options": {
                        "type": "array",
                        "items": {
                          "type": "string"
                        }
                      }
                    },
                    "required": [
                      "id",
                      "question",
                      "proposed_answer"
                    ]
                  }
                },
                "suggested_stages": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "name": {
                        "type": "string"
                      },
                      "reason": {
                        "type": "string"
                      }
                    },
                    "required": [
                      "name",
                      "reason"
                    ]
                  }
                }
              },
              "required": [
                "research",
                "questions",
                "suggested_stages"
              ]
            }""";

    public static final String FINDINGS = """
            {
              "type": "object",
              "properties": {
                "summary": {
                  "type": "string"
                },
                "findings": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "id": {
                        "type": "string"
                      },
                      "title": {
                        "type": "string"
                      },
                      "description": {
                        "type": "string"
                      },
                      "severity": {
                        "type": "string",
                        "enum": [
                          "critical",
                          "warning",
                          "info"
                        ]
                      },
                      "category": {
                        "type": "string"
                      },
                      "file_path": {
                        "type": "string"
                      },
                      "selected": {
                        "type": "boolean"
                      }
                    },
                    "required": [
                      "id",
                      "title",
                      "description",
                      "severity",
                      "selected"
                    ]
                  }
                }
              },
              "required": [
                "summary",
                "findings"
              ]
            }""";

    public static final String APPROACHES = """
            {
              "type": "object",
              "properties": {
                "options": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "id": {
                        "type": "string"
                      },
                      "title": {
                        "type": "string"
                      },
                      "description": {
                        "type": "string"
                      },
                      "pros": {
                        "type": "array",
                        "items": {
                          "type": "string"
                        }
                      },
                      "cons": {
                        "type": "array",
                        "items": {
                          "type": "string"
                        }
                      }
                    },
                    "required": [
                      "id",
                      "title",
                      "description",
                      "pros",
                      "cons"
                    ]
                  }
                },
                "questions": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "id": {
                        "type": "string"
                      },
                      "question": {
                        "type": "string"
                      },
                      "proposed_answer": {
                        "type": "string"
                      },
                      "options": {
                        "type": "array",
                        "items": {
                          "type": "string"
                        }
                      }
                    },
                    "required": [
                      "id",
                      "question",
                      "proposed_answer"
                    ]
                  }
                }
              },
              "required": [
                "options",
                "questions"
              ]
            }""";

    public static final String PLANNING = """
            {
              "type": "object",
              "properties": {
                "plan": {
                  "type": "string"
                },
                "questions": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "id": {
                        "type": "string"
                      },
                      "question": {
                        "type": "string"
                      },
                      "proposed_answer": {
                        "type": "string"
                      },
                      "options": {
                        "type": "array",
                        "items": {
                          "type": "string"
                        }
                      }
                    },
                    "required": [
                      "id",
                      "question",
                      "proposed_answer"
                    ]
                  }
                }
              },
              "required": [
                "plan",
                "questions"
              ]
            }""";

    public static final String PR_PREPARATION = """
            {
              "type": "object",
              "properties": {
                "fields": {
                  "type": "object",
                  "properties": {
                    "title": {
                      "type": "string"
                    },
                    "description": {
                      "type": "string"
                    },
                    "test_plan": {
                      "type": "string"
                    }
                  },
                  "required": [
                    "title",
                    "description",
                    "test_plan"
                  ]
                }
              },
              "required": [
                "fields"
              ]
            }""";

    public static final String TASK_SPLITTING = """
            {
              "type": "object",
              "properties": {
                "reasoning": {
                  "type": "string",
                  "description": "Explanation of why this task should be split and how the subtasks relate to the whole."
                },
                "proposed_tasks": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "id": {
                        "type": "string"
                      },
                      "title": {
                        "type": "string",
                        "description": "Actionable title starting with a verb"
                      },
                      "description": {
                        "type": "string",
                        "description": "Enough context to work on independently"
                      },
                      "selected": {
                        "type": "boolean",
                        "description": "true for recommended subtasks, false for optional"
                      }
                    },
                    "required": [
                      "id",
                      "title",
                      "description",
                      "selected"
                    ]
                  }
                }
              },
              "required": [
                "reasoning",
                "proposed_tasks"
              ]
            }""";
}
