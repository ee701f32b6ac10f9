package com.example.memocache.memo;

import com.example.memocache.core.InvalidTtlException;
import java.lang.reflect.Method;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.context.expression.MethodBasedEvaluationContext;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.stereotype.Component;

/**
 * Applies {@link Memoized}. Checked exceptions thrown by the method pass through unchanged; they
 * are tunnelled through the cache fill as {@link InvocationFailure} and unwrapped here.
 */
@Aspect
@Component
public class MemoizedAspect {

    private final Memoizer memoizer;

    private final ExpressionParser parser = new SpelExpressionParser();
    private final ParameterNameDiscoverer paramDiscoverer = new DefaultParameterNameDiscoverer();

    public MemoizedAspect(Memoizer memoizer) {
        this.memoizer = memoizer;
    }

    @Around("@annotation(memoized)")
    public Object memoize(ProceedingJoinPoint joinPoint, Memoized memoized) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        String functionId = memoized.name().isEmpty()
            ? method.getDeclaringClass().getName() + "#" + method.getName()
            : memoized.name();
        String cacheKey = generateKey(joinPoint, method, functionId, memoized.key());
        long ttl = memoized.ttlSeconds() == 0
            ? memoizer.getDefaultTtlSeconds()
            : InvalidTtlException.requirePositive(memoized.ttlSeconds());

        try {
            return memoizer.lookupOrLoad(cacheKey, ttl, () -> proceed(joinPoint));
        } catch (InvocationFailure failure) {
            throw failure.getCause();
        }
    }

    private String generateKey(ProceedingJoinPoint joinPoint, Method method, String functionId, String keyExpression) {
        if (keyExpression.isEmpty()) {
            return memoizer.getDefaultKeyGenerator().generate(functionId, joinPoint.getArgs());
        }
        EvaluationContext context =
            new MethodBasedEvaluationContext(joinPoint.getTarget(), method, joinPoint.getArgs(), paramDiscoverer);
        Object suffix = parser.parseExpression(keyExpression).getValue(context);
        return functionId + ":" + suffix;
    }

    private static Object proceed(ProceedingJoinPoint joinPoint) {
        try {
            return joinPoint.proceed();
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new InvocationFailure(t);
        }
    }

    static final class InvocationFailure extends RuntimeException {

        InvocationFailure(Throwable cause) {
            super(cause);
        }
    }
}
