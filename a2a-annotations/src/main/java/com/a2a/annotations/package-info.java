/**
 * Annotations and lifecycle contracts shared by A2A plugins.
 * <ul>
 *   <li>{@link com.a2a.annotations.A2aPlugin}: id, slot and display metadata for plugin classes</li>
 *   <li>{@link com.a2a.annotations.ResourceCleanup}: onExit() for shutdown</li>
 * </ul>
 */
package com.a2a.annotations;
