/**
 * Probe scheduling.
 */
package com.mimecast.mailhealth.cron;
