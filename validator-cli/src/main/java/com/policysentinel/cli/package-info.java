/**
 * Command-line front end: validates a registry or runs a fixture and prints
 * the result as JSON.
 */
package com.policysentinel.cli;
