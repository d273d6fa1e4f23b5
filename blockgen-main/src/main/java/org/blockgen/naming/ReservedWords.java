package org.blockgen.naming;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Identifiers that allocated names must never take. This only keeps generated programs from
 * clobbering keywords and built-ins by accident; it is not a security feature.
 */
public final class ReservedWords {

    static final String KEYWORDS =
            // https://developer.mozilla.org/en-US/docs/Web/JavaScript/Reference/Lexical_grammar#keywords
            "break,case,catch,class,const,continue,debugger,default,delete,do,else,export,extends,finally,for," +
            "function,if,import,in,instanceof,new,return,super,switch,this,throw,try,typeof,var,void,while,with," +
            "yield,enum,implements,interface,let,package,private,protected,public,static,await,null,true,false," +
            // Magic variable.
            "arguments";

    static final String GLOBALS =
            "globalThis,Infinity,NaN,undefined,eval,isFinite,isNaN,parseFloat,parseInt,decodeURI," +
            "decodeURIComponent,encodeURI,encodeURIComponent,escape,unescape,Object,Function,Boolean,Symbol,Error," +
            "AggregateError,EvalError,RangeError,ReferenceError,SyntaxError,TypeError,URIError,Number,BigInt,Math," +
            "Date,String,RegExp,Array,Int8Array,Uint8Array,Uint8ClampedArray,Int16Array,Uint16Array,Int32Array," +
            "Uint32Array,Float32Array,Float64Array,BigInt64Array,BigUint64Array,Map,Set,WeakMap,WeakSet,WeakRef," +
            "FinalizationRegistry,ArrayBuffer,SharedArrayBuffer,DataView,Atomics,JSON,Promise,Proxy,Reflect,Intl," +
            "console,process,global,require,module,exports,Buffer,setTimeout,clearTimeout,setInterval," +
            "clearInterval,setImmediate,clearImmediate,queueMicrotask,structuredClone";

    static final String WEBPPL_BUILTINS =
            "Infer,Enumerate,Rejection,MCMC,SMC,Optimize,ForwardSample,sample,factor,condition,observe,flip," +
            "uniform,gaussian,categorical,discrete,randomInteger,mem,cache,display,error,assert,repeat,map,map2," +
            "mapN,mapIndexed,mapObject,mapData,filter,find,reduce,sum,product,listMean,listVar,listStdev,expectation," +
            "marginalize,zip,first,second,last,append,remove,range,sort,sortOn,any,all,Bernoulli,Beta,Binomial," +
            "Categorical,Cauchy,Delta,DiagCovGaussian,Dirichlet,Discrete,Exponential,Gamma,Gaussian,KDE,Laplace," +
            "LogisticNormal,LogitNormal,Marginal,Mixture,Multinomial,MultivariateBernoulli,MultivariateGaussian," +
            "Poisson,RandomInteger,SampleBasedMarginal,TensorGaussian,TensorLaplace,Uniform,UniformDrift," +
            "viz,json,webpplObjectToText,param,modelParam,T,Vector,Matrix,Tensor,ad,dists";

    private ReservedWords() {}

    /**
     * Keywords, host globals and WebPPL built-ins.
     */
    public static Set<String> webppl() {
        Set<String> words = new LinkedHashSet<>();
        words.addAll(parse(KEYWORDS));
        words.addAll(parse(GLOBALS));
        words.addAll(parse(WEBPPL_BUILTINS));
        return Collections.unmodifiableSet(words);
    }

    public static Set<String> webppl(Collection<String> extra) {
        Set<String> words = new LinkedHashSet<>(webppl());
        words.addAll(extra);
        return Collections.unmodifiableSet(words);
    }

    /**
     * Splits a comma separated word list, ignoring blanks.
     */
    public static Set<String> parse(String commaSeparated) {
        Set<String> words = new LinkedHashSet<>();
        for (String word : commaSeparated.split(",")) {
            String trimmed = word.trim();
            if (!trimmed.isEmpty()) {
                words.add(trimmed);
            }
        }
        return words;
    }
}
