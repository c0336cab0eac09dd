/**
 * Operations running workloads on a Kubernetes cluster: a pod, a job, or a manual run of a CronJob,
 * each waited for, with its logs captured as output.
 */
package io.flowkube.kubernetes;
