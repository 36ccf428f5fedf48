package com.calypso.deploy;

import com.calypso.core.model.GeneratedFile;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Access gate and status banner injected into preview deployments.
 * <p>
 * The gate hides the page unless the visitor carries the preview token, either as
 * the {@code __pv_token} query parameter (then remembered in localStorage) or from
 * an earlier visit. The banner asks the app whether the project is published.
 */
public final class PreviewScripts {

    public static final String GATE_PATH = "public/__preview_gate.js";
    public static final String BANNER_PATH = "public/__preview_banner.js";
    public static final String TOKEN_PARAM = "__pv_token";

    static final Pattern NEXT_LAYOUT = Pattern.compile("^(src/)?app/layout\\.(tsx|jsx|ts|js)$");
    private static final Pattern BODY_CLOSE = Pattern.compile("</body>", Pattern.CASE_INSENSITIVE);

    static final String GATE_TAG = "<script src=\"/__preview_gate.js\"></script>";
    static final String BANNER_TAG = "<script src=\"/__preview_banner.js\"></script>";
    static final String NEXT_SCRIPT_IMPORT = "import Script from \"next/script\";";
    static final String NEXT_SCRIPT_TAGS = """
            <Script src="/__preview_gate.js" strategy="beforeInteractive" />
            <Script src="/__preview_banner.js" strategy="afterInteractive" />
            </body>""";

    private PreviewScripts() {}

    public static String gateScript(String token) {
        return """
                (function(){
                  var T='%s',K='%s';
                  var p=new URLSearchParams(window.location.search).get(K);
                  if(p===T){try{localStorage.setItem(K,T)}catch(e){}
                    var u=new URL(window.location);u.searchParams.delete(K);
                    window.history.replaceState(null,'',u.toString());return}
                  try{if(localStorage.getItem(K)===T)return}catch(e){}
                  document.documentElement.innerHTML='<body style="margin:0;display:flex;align-items:center;justify-content:center;height:100vh;font-family:system-ui,-apple-system,sans-serif;background:#fafafa;color:#71717a"><div style="text-align:center"><h1 style="font-size:18px;font-weight:600;color:#18181b;margin:0 0 8px">Preview not available</h1><p style="font-size:14px;margin:0">This preview link is private.</p></div></body>';
                  window.stop();
                })();
                """.formatted(token, TOKEN_PARAM);
    }

    /**
     * Fixed top bar with a publication pill and a link back to the build page.
     * The pill starts as "Not published" and is refreshed from the status endpoint.
     */
    public static String bannerScript(String projectId, String token, String appUrl) {
        return """
                (function(){
                  if(window.__pvBanner)return;window.__pvBanner=true;
                  var A='%1$s',P='%2$s',T='%3$s';
                  var d=document,b=d.createElement('div');
                  b.setAttribute('style','position:fixed;top:0;left:0;right:0;z-index:999999;display:flex;align-items:center;justify-content:space-between;padding:8px 16px;background:#18181b;color:#fff;font-family:system-ui,-apple-system,sans-serif;font-size:13px;box-shadow:0 2px 8px rgba(0,0,0,.15);');
                  b.innerHTML='<div style="display:flex;align-items:center;gap:8px"><span style="opacity:.7">Preview</span><span id="__pv_pill" style="background:rgba(245,158,11,.15);color:#f59e0b;padding:2px 8px;border-radius:9999px;font-size:11px;font-weight:500">Not published</span></div><a href="'+A+'/project/'+P+'/build" style="display:inline-flex;align-items:center;padding:5px 14px;background:#fff;color:#18181b;border-radius:6px;text-decoration:none;font-size:12px;font-weight:600">Publish</a>';
                  d.body.prepend(b);
                  d.body.style.paddingTop='40px';
                  function pill(text,color,bg){var s=d.getElementById('__pv_pill');if(!s)return;s.textContent=text;s.style.color=color;s.style.background=bg}
                  fetch(A+'/api/v1/projects/'+P+'/preview/status?token='+encodeURIComponent(T))
                    .then(function(r){return r.ok?r.json():null})
                    .then(function(s){
                      if(!s||!s.published)return;
                      if(s.isStale)pill('Update available','#3b82f6','rgba(59,130,246,.15)');
                      else pill('Published','#22c55e','rgba(34,197,94,.15)');
                    })
                    .catch(function(){});
                })();
                """.formatted(appUrl, projectId, token);
    }

    /**
     * Returns a copy of {@code files} with both scripts added under {@code public/} and
     * referenced from the Next.js root layout when there is one, else from every HTML page.
     */
    public static List<GeneratedFile> inject(List<GeneratedFile> files, String projectId, String token,
                                             String appUrl) {
        List<GeneratedFile> injected = new ArrayList<>(files);
        injected.add(new GeneratedFile(GATE_PATH, gateScript(token)));
        injected.add(new GeneratedFile(BANNER_PATH, bannerScript(projectId, token, appUrl)));

        int layoutIdx = -1;
        for (int i = 0; i < injected.size(); i++) {
            if (NEXT_LAYOUT.matcher(injected.get(i).path()).matches()) {
                layoutIdx = i;
                break;
            }
        }

        if (layoutIdx >= 0) {
            GeneratedFile layout = injected.get(layoutIdx);
            injected.set(layoutIdx, new GeneratedFile(layout.path(), injectIntoLayout(layout.content())));
            return injected;
        }

        for (int i = 0; i < injected.size(); i++) {
            GeneratedFile file = injected.get(i);
            if (file.path().endsWith(".html")) {
                injected.set(i, new GeneratedFile(file.path(), injectIntoHtml(file.content())));
            }
        }
        return injected;
    }

    static String injectIntoLayout(String content) {
        String result = content.contains("next/script") ? content : NEXT_SCRIPT_IMPORT + "\n" + content;
        return BODY_CLOSE.matcher(result).replaceFirst(Matcher.quoteReplacement(NEXT_SCRIPT_TAGS));
    }

    static String injectIntoHtml(String html) {
        String result = html;
        int headOpen = result.indexOf("<head>");
        if (headOpen >= 0) {
            int insertAt = headOpen + "<head>".length();
            result = result.substring(0, insertAt) + GATE_TAG + result.substring(insertAt);
        }
        int bodyClose = result.lastIndexOf("</body>");
        if (bodyClose >= 0) {
            result = result.substring(0, bodyClose) + BANNER_TAG + result.substring(bodyClose);
        } else {
            result = result + BANNER_TAG;
        }
        return result;
    }
}
