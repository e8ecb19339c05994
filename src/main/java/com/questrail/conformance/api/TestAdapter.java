package com.questrail.conformance.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type as a test adapter: the interaction boundary between the test
 * and the system under test.
 *
 * <h3>Semantics</h3>
 * <ul>
 *   <li>A type is classified as an adapter if it, or any interface or base class
 *       it transitively extends or implements, carries this annotation.</li>
 *   <li>Members declared on adapter types are adapter-scoped: adapters are
 *       singletons, so observations of their events and returns carry no target
 *       instance, and checkers are never handed one.</li>
 * </ul>
 *
 * <h3>Typical Usage</h3>
 * <pre>{@code
 * @TestAdapter
 * public interface FileServerAdapter {
 *     void addFileCreatedListener(FileCreatedListener listener);
 * }
 * }</pre>
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface TestAdapter {
}
