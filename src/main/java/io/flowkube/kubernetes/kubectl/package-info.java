/**
 * Operations on any resource addressed by apiVersion and kind: get, list, create, merge patch,
 * wait for a condition, and pod logs.
 */
package io.flowkube.kubernetes.kubectl;
