package com.github.salilvnair.convflow.annotation;

import com.github.salilvnair.convflow.config.DialogFlowAutoConfiguration;
import org.springframework.context.annotation.Import;
import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(DialogFlowAutoConfiguration.class)
public @interface EnableConvFlow {
}
