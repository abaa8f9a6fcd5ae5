package com.github.salilvnair.convflow.engine.expression.spel;

import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import com.github.salilvnair.convflow.engine.expression.Expression;
import org.springframework.expression.spel.support.StandardEvaluationContext;

import java.util.Map;

public class SpelExpression implements Expression {

    private final String source;
    private final org.springframework.expression.Expression expression;

    SpelExpression(String source, org.springframework.expression.Expression expression) {
        this.source = source;
        this.expression = expression;
    }

    @Override
    public Object evaluate(TurnContext ctx, Map<String, Object> params) {
        StandardEvaluationContext evaluationContext = new StandardEvaluationContext(ctx.variables(params));
        evaluationContext.addPropertyAccessor(new RecognitionPropertyAccessor());
        evaluationContext.addPropertyAccessor(new LenientMapAccessor());
        if (params != null) {
            params.forEach(evaluationContext::setVariable);
        }
        try {
            return expression.getValue(evaluationContext);
        } catch (DialogFlowException e) {
            throw e;
        } catch (RuntimeException e) {
            // besides EvaluationException, SpEL lets arithmetic errors and exceptions of invoked methods through
            throw new DialogFlowException(
                    DialogFlowErrorCode.EXPRESSION_EVALUATION_FAILED,
                    "Failed to evaluate '" + source + "': " + e.getMessage(),
                    e
            ).withMetaData(Map.of("expression", source));
        }
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return "SpelExpression[" + source + "]";
    }
}
