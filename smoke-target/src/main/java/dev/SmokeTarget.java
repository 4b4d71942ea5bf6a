package dev;

import com.sun.net.httpserver.*;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;

/**
 * 로컬 스모크용 가짜 회원 디렉터리.
 *  - base      : 디렉터리 페이지 (회원 사이트 링크 목록)
 *  - base+1..3 : 회원 사이트 (포트가 다르므로 서로 다른 사이트 루트)
 *  - base+4    : 링크만 있고 서버 없음 → 홈 fetch 실패(FAILED)
 *
 * 실행 후:  contact-finder crawl --directory-url http://localhost:8080/medlemmar --delay 0
 */
public class SmokeTarget {

  static void add(HttpServer s, String path, HttpHandler h) { s.createContext(path, h); }

  public static void main(String[] args) throws Exception {
    int base = (args.length > 0) ? Integer.parseInt(args[0]) : 8080;

    HttpServer directory = server(base);
    wireDirectory(directory, base);
    directory.start();
    System.out.println("[CF] directory on http://localhost:" + base + "/medlemmar");

    HttpServer a = server(base + 1);
    wireMemberA(a);
    a.start();

    HttpServer b = server(base + 2);
    wireMemberB(b);
    b.start();

    HttpServer c = server(base + 3);
    wireMemberC(c);
    c.start();

    System.out.println("[CF] members on ports " + (base + 1) + ".." + (base + 3)
        + " (" + (base + 4) + " intentionally offline)");
  }

  static HttpServer server(int port) throws IOException {
    HttpServer s = HttpServer.create(new InetSocketAddress(port), 0);
    s.setExecutor(Executors.newFixedThreadPool(4));
    return s;
  }

  // 디렉터리: 같은 회원을 여러 경로로 링크 (사이트 루트로 접히는지 확인용)
  static void wireDirectory(HttpServer s, int base) {
    add(s, "/", ex -> {
      String path = ex.getRequestURI().getPath();
      if (!path.equals("/medlemmar") && !path.equals("/")) { resp(ex, 404, "text/plain", "not found"); return; }
      StringBuilder html = new StringBuilder("<html><body><h1>Våra medlemmar</h1><ul>");
      html.append(li("http://localhost:" + (base + 1) + "/", "Tidning A"));
      html.append(li("http://localhost:" + (base + 1) + "/nyheter?id=7", "Tidning A nyheter"));
      html.append(li("http://localhost:" + (base + 2) + "/start", "Magasin B"));
      html.append(li("http://localhost:" + (base + 3) + "/", "Förlag C"));
      html.append(li("http://localhost:" + (base + 4) + "/", "Nedlagd D"));
      html.append(li("mailto:kansli@localhost", "Kansliet"));
      html.append(li("/om-foreningen", "Om föreningen"));
      html.append("</ul></body></html>");
      resp(ex, 200, "text/html", html.toString());
    });
  }

  // A: e-post på startsidan, telefon på Kontakt-sidan
  static void wireMemberA(HttpServer s) {
    add(s, "/", ex -> {
      String path = ex.getRequestURI().getPath();
      switch (path) {
        case "/" -> resp(ex, 200, "text/html",
            "<html><body><p>Redaktionen nås på red@tidning-a.se</p>"
            + "<a href=\"/kontakt\">Kontakt</a> <a href=\"/prenumerera\">Prenumerera</a></body></html>");
        case "/kontakt" -> resp(ex, 200, "text/html",
            "<html><body><p>Växel: +46 8 123 45 67</p><p>annons@tidning-a.se</p></body></html>");
        default -> resp(ex, 404, "text/plain", "not found");
      }
    });
  }

  // B: maskerad e-post, Kontakt-sidan svarar 500 → PARTIAL
  static void wireMemberB(HttpServer s) {
    add(s, "/", ex -> {
      String path = ex.getRequestURI().getPath();
      switch (path) {
        case "/" -> resp(ex, 200, "text/html",
            "<html><body><p>Skriv till info (at) magasin-b [dot] se</p>"
            + "<a href=\"/contact-us\">Write to us</a></body></html>");
        case "/contact-us" -> resp(ex, 500, "text/plain", "boom");
        default -> resp(ex, 404, "text/plain", "not found");
      }
    });
  }

  // C: about-sida + redaktion-sida
  static void wireMemberC(HttpServer s) {
    add(s, "/", ex -> {
      String path = ex.getRequestURI().getPath();
      switch (path) {
        case "/" -> resp(ex, 200, "text/html",
            "<html><body><nav><a href=\"/about\">About</a> <a href=\"/redaktion\">Redaktion</a></nav></body></html>");
        case "/about" -> resp(ex, 200, "text/html", "<p>Förlag C, Box 123, 111 22 Stockholm</p>");
        case "/redaktion" -> resp(ex, 200, "text/html",
            "<p>Chefredaktör: chef@forlag-c.se, tel 070-123 45 67</p>");
        default -> resp(ex, 404, "text/plain", "not found");
      }
    });
  }

  static String li(String href, String text) {
    return "<li><a href=\"" + href + "\">" + text + "</a></li>";
  }

  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", ct + "; charset=utf-8");
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
