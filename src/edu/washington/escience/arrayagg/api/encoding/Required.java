/**
 *
 * Annotation for describing a field is required in the JSON aggregate request encoding.
 *
 */
package edu.washington.escience.arrayagg.api.encoding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Required {}
