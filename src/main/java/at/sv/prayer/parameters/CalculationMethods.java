package at.sv.prayer.parameters;

public final class CalculationMethods {

    private CalculationMethods() {
    }

    /**
     * @return the angles, adjustments and rounding defined by the given method, all other properties at their defaults
     */
    public static Parameters parameters(CalculationMethod method) {
        return switch (method) {
            case MUSLIM_WORLD_LEAGUE -> angles(method, 18.0, 17.0)
                    .methodAdjustments(TimeAdjustments.builder().dhuhr(1).build())
                    .build();
            case EGYPTIAN -> angles(method, 19.5, 17.5)
                    .methodAdjustments(TimeAdjustments.builder().dhuhr(1).build())
                    .build();
            case KARACHI -> angles(method, 18.0, 18.0)
                    .methodAdjustments(TimeAdjustments.builder().dhuhr(1).build())
                    .build();
            case UMM_AL_QURA -> angles(method, 18.5, 0.0)
                    .ishaInterval(90)
                    .build();
            case DUBAI -> angles(method, 18.2, 18.2)
                    .methodAdjustments(TimeAdjustments.builder().sunrise(-3).dhuhr(3).asr(3).maghrib(3).build())
                    .build();
            case MOONSIGHTING_COMMITTEE -> angles(method, 18.0, 18.0)
                    .methodAdjustments(TimeAdjustments.builder().dhuhr(5).maghrib(3).build())
                    .build();
            case NORTH_AMERICA -> angles(method, 15.0, 15.0)
                    .methodAdjustments(TimeAdjustments.builder().dhuhr(1).build())
                    .build();
            case KUWAIT -> angles(method, 18.0, 17.5)
                    .build();
            case QATAR -> angles(method, 18.0, 0.0)
                    .ishaInterval(90)
                    .build();
            case SINGAPORE -> angles(method, 20.0, 18.0)
                    .methodAdjustments(TimeAdjustments.builder().dhuhr(1).build())
                    .rounding(Rounding.UP)
                    .build();
            case TEHRAN -> angles(method, 17.7, 14.0)
                    .maghribAngle(4.5)
                    .build();
            case TURKEY -> angles(method, 18.0, 17.0)
                    .methodAdjustments(TimeAdjustments.builder().sunrise(-7).dhuhr(5).asr(4).maghrib(7).build())
                    .build();
            case OTHER -> angles(method, 0.0, 0.0)
                    .build();
        };
    }

    private static Parameters.ParametersBuilder angles(CalculationMethod method, double fajrAngle, double ishaAngle) {
        return Parameters.builder()
                         .method(method)
                         .fajrAngle(fajrAngle)
                         .ishaAngle(ishaAngle);
    }
}
