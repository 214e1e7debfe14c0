/**
 * Service sections: global, developer, command processing and puppetdb.
 */
package com.mimecast.pdbconf.config.server;
