/**
 * Quartz cron schedules.
 */
package com.workflowops.core.schedule;
