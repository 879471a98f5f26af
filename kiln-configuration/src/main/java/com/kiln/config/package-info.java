/**
 * Host settings ({@link com.kiln.config.KilnConfig}, read from the environment) and accumulating
 * component configuration decoding ({@link com.kiln.config.ConfigDecoder}).
 */
package com.kiln.config;
