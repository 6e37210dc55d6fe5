package org.waabox.concordia.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the Concordia server.
 *
 * <p>Reconciles a Glue Up organization into a Circle community, on demand
 * through its REST endpoints or when Glue Up notifies a change:
 * <ul>
 *   <li>member sync: invites and space memberships</li>
 *   <li>event sync: creates, updates and deletes Circle events</li>
 *   <li>state kept on the local filesystem or in S3</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class ConcordiaServerApplication {

  /**
   * Launches the Spring Boot application.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(ConcordiaServerApplication.class, args);
  }
}
