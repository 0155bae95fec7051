package insight.engine.query;

// One APPLY entry: outputName computed per group by applying token to sourceField (unqualified).
public record ApplyRule(String outputName, ApplyToken token, String sourceField) {}
