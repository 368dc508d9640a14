// This file is part of SPPMon.
// Copyright (C) 2021  The SPPMon Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.sppmon.storage;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.concurrent.TimeUnit;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

import org.influxdb.InfluxDB;
import org.influxdb.InfluxDBFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

import net.sppmon.exceptions.InfluxConnectionException;
import okhttp3.OkHttpClient;

/**
 * Opens connections to InfluxDB. Override {@link #connect} to hand out 
 * other connections, e.g. in tests.
 * 
 * @since 1.0
 */
public class InfluxConnector {
  private static final Logger LOG = LoggerFactory.getLogger(
      InfluxConnector.class);
  
  private static final X509TrustManager BLIND_TRUST_MANAGER = 
      new X509TrustManager() {
    @Override
    public void checkClientTrusted(final X509Certificate[] certs, 
                                   final String auth_type) {
      // trust all
    }

    @Override
    public void checkServerTrusted(final X509Certificate[] certs, 
                                   final String auth_type) {
      // trust all
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  };
  
  /**
   * Opens a connection. Nothing is sent until the first request.
   * @param config The non-null settings.
   * @param timeout_seconds The connect, read and write timeout.
   * @return The connection.
   * @throws InfluxConnectionException if the SSL context could not be set up.
   */
  public InfluxDB connect(final InfluxClientConfig config, 
                          final long timeout_seconds) {
    final OkHttpClient.Builder http = new OkHttpClient.Builder()
        .connectTimeout(timeout_seconds, TimeUnit.SECONDS)
        .readTimeout(timeout_seconds, TimeUnit.SECONDS)
        .writeTimeout(timeout_seconds, TimeUnit.SECONDS);
    if (config.ssl() && !config.verifySsl()) {
      LOG.warn("Certificate of the InfluxDB server at " + config.address() 
          + " is not verified.");
      try {
        final SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[] { BLIND_TRUST_MANAGER }, 
            new SecureRandom());
        http.sslSocketFactory(context.getSocketFactory(), BLIND_TRUST_MANAGER)
            .hostnameVerifier((host, session) -> true);
      } catch (GeneralSecurityException e) {
        throw new InfluxConnectionException("Failed to set up SSL for " 
            + config.url(), e);
      }
    }
    
    if (LOG.isDebugEnabled()) {
      LOG.debug("Connecting to " + config.url() + " with a timeout of " 
          + timeout_seconds + "s");
    }
    if (Strings.isNullOrEmpty(config.username())) {
      return InfluxDBFactory.connect(config.url(), http);
    }
    return InfluxDBFactory.connect(config.url(), config.username(), 
        config.password(), http);
  }
}
