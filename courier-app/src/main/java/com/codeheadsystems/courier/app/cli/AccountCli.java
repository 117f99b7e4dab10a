package com.codeheadsystems.courier.app.cli;

import com.codeheadsystems.courier.client.accessor.AccountAccessor;
import com.codeheadsystems.courier.client.exceptions.AccountAccessorException;
import com.codeheadsystems.courier.client.model.AccountResult;
import com.codeheadsystems.courier.client.model.ServerConnectionInfo;
import com.codeheadsystems.courier.model.CreateUserRequest;
import com.codeheadsystems.courier.model.UpdateUserRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Command-line client for exercising a running courier server.
 *
 * <pre>
 * Usage:
 *   AccountCli &lt;command&gt; [arguments] [options]
 *
 * Commands:
 *   create &lt;email&gt; &lt;password&gt; &lt;handle&gt; &lt;publicKey&gt;   Register a user.
 *   login  &lt;email&gt; &lt;password&gt;                       Print a session token.
 *   get    &lt;email&gt;                                  Show a user.
 *   list                                            List every email.
 *   update &lt;email&gt; &lt;password&gt;                       Log in, then change the fields given as options.
 *   delete &lt;email&gt; &lt;password&gt;                       Log in, then delete the user.
 *
 * Options:
 *   --server &lt;url&gt;            Server base URL (default: http://localhost:8080)
 *   --handle &lt;handle&gt;         New handle (update)
 *   --bio &lt;bio&gt;               New bio (update)
 *   --public-key &lt;key&gt;        New public key (update)
 *   --new-password &lt;pw&gt;       New password (update)
 * </pre>
 * Exit status is 0 on success, 2 when the server answers Failure or Error, and 1 for usage or
 * transport problems.
 */
public class AccountCli {

  static final int OK = 0;
  static final int USAGE_OR_TRANSPORT = 1;
  static final int REJECTED = 2;

  private static final String DEFAULT_SERVER = "http://localhost:8080";

  private final Function<URI, AccountAccessor> accessorFactory;
  private final PrintStream out;
  private final PrintStream err;

  /**
   * Instantiates a new Account cli.
   *
   * @param accessorFactory builds an accessor for the server URL
   * @param out             standard output
   * @param err             standard error
   */
  public AccountCli(Function<URI, AccountAccessor> accessorFactory, PrintStream out, PrintStream err) {
    this.accessorFactory = accessorFactory;
    this.out = out;
    this.err = err;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    AccountCli cli = new AccountCli(
        uri -> new AccountAccessor(HttpClient.newHttpClient(), new ObjectMapper(), new ServerConnectionInfo(uri)),
        System.out, System.err);
    System.exit(cli.run(args));
  }

  /**
   * Parses the arguments and runs one command.
   *
   * @param args command-line arguments
   * @return the process exit status
   */
  public int run(String[] args) {
    String server = DEFAULT_SERVER;
    String handle = null;
    String bio = null;
    String publicKey = null;
    String newPassword = null;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        positional.add(arg);
        continue;
      }
      if (i + 1 >= args.length) {
        err.println("Missing value for option " + arg);
        return usage();
      }
      String value = args[++i];
      switch (arg) {
        case "--server"       -> server      = value;
        case "--handle"       -> handle      = value;
        case "--bio"          -> bio         = value;
        case "--public-key"   -> publicKey   = value;
        case "--new-password" -> newPassword = value;
        default -> {
          err.println("Unknown option: " + arg);
          return usage();
        }
      }
    }
    if (positional.isEmpty()) {
      printUsage();
      return USAGE_OR_TRANSPORT;
    }

    String command = positional.get(0);
    List<String> operands = positional.subList(1, positional.size());
    AccountAccessor accessor = accessorFactory.apply(URI.create(server));
    try {
      return switch (command) {
        case "create" -> requireOperands(operands, 4) ? report(accessor.createUser(new CreateUserRequest(
            operands.get(0), operands.get(1), operands.get(2), operands.get(3)))) : usage();
        case "login" -> requireOperands(operands, 2)
            ? report(accessor.login(operands.get(0), operands.get(1))) : usage();
        case "get" -> requireOperands(operands, 1) ? report(accessor.getUser(operands.get(0))) : usage();
        case "list" -> report(accessor.listUsers());
        case "update" -> requireOperands(operands, 2)
            ? runUpdate(accessor, operands.get(0), operands.get(1),
                new UpdateUserRequest(newPassword, handle, publicKey, bio))
            : usage();
        case "delete" -> requireOperands(operands, 2)
            ? runDelete(accessor, operands.get(0), operands.get(1)) : usage();
        default -> {
          err.println("Unknown command: " + command);
          yield usage();
        }
      };
    } catch (AccountAccessorException e) {
      err.println("Error: " + e.getMessage());
      return USAGE_OR_TRANSPORT;
    }
  }

  private int runUpdate(AccountAccessor accessor, String email, String password, UpdateUserRequest request) {
    AccountResult<String> login = accessor.login(email, password);
    if (!login.isSuccess()) {
      return report(login);
    }
    return report(accessor.updateUser(email, login.value(), request));
  }

  private int runDelete(AccountAccessor accessor, String email, String password) {
    AccountResult<String> login = accessor.login(email, password);
    if (!login.isSuccess()) {
      return report(login);
    }
    return report(accessor.deleteUser(email, login.value()));
  }

  private int report(AccountResult<?> result) {
    if (result.isSuccess()) {
      out.println(result.value());
      return OK;
    }
    err.println(result.status() + ": " + result.message());
    return REJECTED;
  }

  private boolean requireOperands(List<String> operands, int count) {
    if (operands.size() < count) {
      err.println("Expected " + count + " argument(s), got " + operands.size());
      return false;
    }
    return true;
  }

  private int usage() {
    printUsage();
    return USAGE_OR_TRANSPORT;
  }

  private void printUsage() {
    err.println("Usage: AccountCli <command> [arguments] [options]");
    err.println();
    err.println("Commands:");
    err.println("  create <email> <password> <handle> <publicKey>");
    err.println("  login  <email> <password>");
    err.println("  get    <email>");
    err.println("  list");
    err.println("  update <email> <password> [--handle h] [--bio b] [--public-key k] [--new-password p]");
    err.println("  delete <email> <password>");
    err.println();
    err.println("Options:");
    err.println("  --server <url>   Server base URL (default: " + DEFAULT_SERVER + ")");
  }
}
